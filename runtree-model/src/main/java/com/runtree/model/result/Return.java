package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RETURN statement with its returned values.
 */
public final class Return extends StatusItem<Return> {

    private static final AttributeTable<Return> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<Return>builder("Return")
                    .readOnly("type", Return::getType, ResultCoercions.ITEM_TYPE)
                    .sequence("values", Return::getValues, Return::setValues),
            true)).build();

    private List<String> values = List.of();

    public Return() {
        super(Body.LEAF);
    }

    public static Return fromDict(Map<String, ?> data) {
        return fromDict(Return::new, data);
    }

    public static Return fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Return fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Return> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.RETURN;
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

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = startDict(new LinkedHashMap<>());
        if (!values.isEmpty()) data.put("values", values);
        return finishDict(data);
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("values");
    }
}
