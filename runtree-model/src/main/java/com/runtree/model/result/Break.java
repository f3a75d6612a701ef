package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * BREAK statement.
 */
public final class Break extends StatusItem<Break> {

    private static final AttributeTable<Break> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<Break>builder("Break")
                    .readOnly("type", Break::getType, ResultCoercions.ITEM_TYPE),
            true)).build();

    public Break() {
        super(Body.LEAF);
    }

    public static Break fromDict(Map<String, ?> data) {
        return fromDict(Break::new, data);
    }

    public static Break fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Break fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Break> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.BREAK;
    }

    @Override
    public Map<String, Object> toDict() {
        return finishDict(startDict(new LinkedHashMap<>()));
    }
}
