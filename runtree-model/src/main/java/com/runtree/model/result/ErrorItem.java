package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Invalid syntax in the executed data. The values are the tokens of the offending statement.
 */
public final class ErrorItem extends StatusItem<ErrorItem> {

    private static final AttributeTable<ErrorItem> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<ErrorItem>builder("Error")
                    .readOnly("type", ErrorItem::getType, ResultCoercions.ITEM_TYPE)
                    .sequence("values", ErrorItem::getValues, ErrorItem::setValues),
            true)).build();

    private List<String> values = List.of();

    public ErrorItem() {
        super(Body.LEAF);
    }

    public static ErrorItem fromDict(Map<String, ?> data) {
        return fromDict(ErrorItem::new, data);
    }

    public static ErrorItem fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static ErrorItem fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<ErrorItem> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.ERROR;
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
