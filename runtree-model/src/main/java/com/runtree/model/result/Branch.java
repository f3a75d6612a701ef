package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.DataException;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One branch of an {@link If} or {@link Try}. Unlike other body items the type is settable,
 * but only to a branch type.
 */
public final class Branch extends StatusItem<Branch> {

    private static final AttributeTable<Branch> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<Branch>builder("Branch")
                    .add("type", Branch::getType, Branch::setType, ResultCoercions.ITEM_TYPE)
                    .add("condition", Branch::getCondition, Branch::setCondition, Coercions.STRING)
                    .sequence("patterns", Branch::getPatterns, Branch::setPatterns)
                    .add("pattern_type", Branch::getPatternType, Branch::setPatternType, Coercions.STRING)
                    .add("assign", Branch::getAssign, Branch::setAssign, Coercions.STRING),
            true)).build();

    private ItemType type;
    private String condition;
    private List<String> patterns = List.of();
    private String patternType;
    private String assign;

    public Branch() {
        this(ItemType.IF);
    }

    public Branch(ItemType type) {
        super(Body.STEPS);
        setType(type);
    }

    public static Branch fromDict(Map<String, ?> data) {
        return fromDict(Branch::new, data);
    }

    public static Branch fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Branch fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Branch> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return type;
    }

    /**
     * @throws DataException if the type is not IF, ELSE IF, ELSE, TRY, EXCEPT or FINALLY
     */
    public void setType(ItemType type) {
        if (type == null || !type.isBranch()) {
            throw new DataException("Invalid branch type '" + type + "'.");
        }
        this.type = type;
    }

    /** Condition of IF and ELSE IF branches. */
    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    /** Error patterns of an EXCEPT branch. */
    public List<String> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = Keyword.immutable(patterns);
    }

    public void addPattern(String pattern) {
        patterns = Keyword.append(patterns, pattern);
    }

    public String getPatternType() {
        return patternType;
    }

    public void setPatternType(String patternType) {
        this.patternType = patternType;
    }

    /** Variable receiving the caught error in {@code EXCEPT ... AS ${var}}. */
    public String getAssign() {
        return assign;
    }

    public void setAssign(String assign) {
        this.assign = assign;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = startDict(new LinkedHashMap<>());
        if (condition != null) data.put("condition", condition);
        if (!patterns.isEmpty()) data.put("patterns", patterns);
        if (patternType != null) data.put("pattern_type", patternType);
        if (assign != null) data.put("assign", assign);
        return finishDict(data);
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("type", "condition", "patterns", "pattern_type", "assign");
    }
}
