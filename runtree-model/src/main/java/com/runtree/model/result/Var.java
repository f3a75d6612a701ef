package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * VAR statement creating a variable.
 */
public final class Var extends StatusItem<Var> {

    private static final AttributeTable<Var> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<Var>builder("Var")
                    .readOnly("type", Var::getType, ResultCoercions.ITEM_TYPE)
                    .add("name", Var::getName, Var::setName, Coercions.STRING)
                    .sequence("value", Var::getValue, Var::setValue)
                    .add("scope", Var::getScope, Var::setScope, Coercions.STRING)
                    .add("separator", Var::getSeparator, Var::setSeparator, Coercions.STRING),
            true)).build();

    private String name = "";
    private List<String> value = List.of();
    private String scope;
    private String separator;

    public Var() {
        super(Body.LEAF);
    }

    public static Var fromDict(Map<String, ?> data) {
        return fromDict(Var::new, data);
    }

    public static Var fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Var fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Var> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.VAR;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name : "";
    }

    public List<String> getValue() {
        return value;
    }

    public void setValue(List<String> value) {
        this.value = Keyword.immutable(value);
    }

    public void addValue(String item) {
        value = Keyword.append(value, item);
    }

    /** {@code LOCAL}, {@code TEST}, {@code SUITE} or {@code GLOBAL}; null means local. */
    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    public String getSeparator() {
        return separator;
    }

    public void setSeparator(String separator) {
        this.separator = separator;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = startDict(new LinkedHashMap<>());
        data.put("name", name);
        data.put("value", value);
        if (scope != null) data.put("scope", scope);
        if (separator != null) data.put("separator", separator);
        return finishDict(data);
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("name", "value", "scope", "separator");
    }
}
