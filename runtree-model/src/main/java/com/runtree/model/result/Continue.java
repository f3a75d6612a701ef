package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CONTINUE statement.
 */
public final class Continue extends StatusItem<Continue> {

    private static final AttributeTable<Continue> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<Continue>builder("Continue")
                    .readOnly("type", Continue::getType, ResultCoercions.ITEM_TYPE),
            true)).build();

    public Continue() {
        super(Body.LEAF);
    }

    public static Continue fromDict(Map<String, ?> data) {
        return fromDict(Continue::new, data);
    }

    public static Continue fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Continue fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Continue> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.CONTINUE;
    }

    @Override
    public Map<String, Object> toDict() {
        return finishDict(startDict(new LinkedHashMap<>()));
    }
}
