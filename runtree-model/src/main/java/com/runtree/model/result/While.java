package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * WHILE loop. The body holds one {@link Iteration} per round.
 */
public final class While extends StatusItem<While> {

    private static final AttributeTable<While> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<While>builder("While")
                    .readOnly("type", While::getType, ResultCoercions.ITEM_TYPE)
                    .add("condition", While::getCondition, While::setCondition, Coercions.STRING)
                    .add("limit", While::getLimit, While::setLimit, Coercions.STRING)
                    .add("on_limit", While::getOnLimit, While::setOnLimit, Coercions.STRING)
                    .add("on_limit_message", While::getOnLimitMessage, While::setOnLimitMessage, Coercions.STRING),
            true)).build();

    private String condition;
    private String limit;
    private String onLimit;
    private String onLimitMessage;

    public While() {
        super(Body.ITERATIONS);
    }

    public static While fromDict(Map<String, ?> data) {
        return fromDict(While::new, data);
    }

    public static While fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static While fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<While> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.WHILE;
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    /** Maximum iteration count or time, as written in the data. */
    public String getLimit() {
        return limit;
    }

    public void setLimit(String limit) {
        this.limit = limit;
    }

    /** {@code PASS} or {@code FAIL}: the loop's status when the limit is reached. */
    public String getOnLimit() {
        return onLimit;
    }

    public void setOnLimit(String onLimit) {
        this.onLimit = onLimit;
    }

    public String getOnLimitMessage() {
        return onLimitMessage;
    }

    public void setOnLimitMessage(String onLimitMessage) {
        this.onLimitMessage = onLimitMessage;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = startDict(new LinkedHashMap<>());
        if (condition != null) data.put("condition", condition);
        if (limit != null) data.put("limit", limit);
        if (onLimit != null) data.put("on_limit", onLimit);
        if (onLimitMessage != null) data.put("on_limit_message", onLimitMessage);
        return finishDict(data);
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("condition", "limit", "on_limit", "on_limit_message");
    }
}
