package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * IF/ELSE structure. The body holds its IF, ELSE IF and ELSE {@link Branch}es.
 */
public final class If extends StatusItem<If> {

    private static final AttributeTable<If> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<If>builder("If")
                    .readOnly("type", If::getType, ResultCoercions.ITEM_TYPE),
            true)).build();

    public If() {
        super(Body.IF_BRANCHES);
    }

    public static If fromDict(Map<String, ?> data) {
        return fromDict(If::new, data);
    }

    public static If fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static If fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<If> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.IF_ELSE_ROOT;
    }

    @Override
    public Map<String, Object> toDict() {
        return finishDict(startDict(new LinkedHashMap<>()));
    }
}
