package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FOR loop. The body holds one {@link Iteration} per round.
 */
public final class For extends StatusItem<For> {

    private static final AttributeTable<For> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<For>builder("For")
                    .readOnly("type", For::getType, ResultCoercions.ITEM_TYPE)
                    .sequence("assign", For::getAssign, For::setAssign)
                    .add("flavor", For::getFlavor, For::setFlavor, Coercions.STRING)
                    .sequence("values", For::getValues, For::setValues)
                    .add("start", For::getStart, For::setStart, Coercions.STRING)
                    .add("mode", For::getMode, For::setMode, Coercions.STRING)
                    .add("fill", For::getFill, For::setFill, Coercions.STRING),
            true)).build();

    private List<String> assign = List.of();
    private String flavor = "IN";
    private List<String> values = List.of();
    private String start;
    private String mode;
    private String fill;

    public For() {
        super(Body.ITERATIONS);
    }

    public static For fromDict(Map<String, ?> data) {
        return fromDict(For::new, data);
    }

    public static For fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static For fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<For> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.FOR;
    }

    /** Loop variables, e.g. {@code ${i}}. */
    public List<String> getAssign() {
        return assign;
    }

    public void setAssign(List<String> assign) {
        this.assign = Keyword.immutable(assign);
    }

    public void addAssign(String variable) {
        assign = Keyword.append(assign, variable);
    }

    /** {@code IN}, {@code IN RANGE}, {@code IN ENUMERATE} or {@code IN ZIP}. */
    public String getFlavor() {
        return flavor;
    }

    public void setFlavor(String flavor) {
        this.flavor = flavor;
    }

    public List<String> getValues() {
        return values;
    }

    public void setValues(List<String> values) {
        this.values = Keyword.immutable(values);
    }

    public void addValue(String value) {
        values = Keyword.append(values, value);
    }

    /** Start index of {@code IN ENUMERATE}. */
    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    /** Mode of {@code IN ZIP}. */
    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    /** Fill value of {@code IN ZIP} in {@code LONGEST} mode. */
    public String getFill() {
        return fill;
    }

    public void setFill(String fill) {
        this.fill = fill;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = startDict(new LinkedHashMap<>());
        data.put("assign", assign);
        data.put("flavor", flavor);
        data.put("values", values);
        if (start != null) data.put("start", start);
        if (mode != null) data.put("mode", mode);
        if (fill != null) data.put("fill", fill);
        return finishDict(data);
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("assign", "flavor", "values", "start", "mode", "fill");
    }
}
