package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TRY/EXCEPT structure. The body holds its TRY, EXCEPT, ELSE and FINALLY {@link Branch}es.
 */
public final class Try extends StatusItem<Try> {

    private static final AttributeTable<Try> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<Try>builder("Try")
                    .readOnly("type", Try::getType, ResultCoercions.ITEM_TYPE),
            true)).build();

    public Try() {
        super(Body.TRY_BRANCHES);
    }

    public static Try fromDict(Map<String, ?> data) {
        return fromDict(Try::new, data);
    }

    public static Try fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Try fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Try> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.TRY_EXCEPT_ROOT;
    }

    @Override
    public Map<String, Object> toDict() {
        return finishDict(startDict(new LinkedHashMap<>()));
    }
}
