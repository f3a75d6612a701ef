package com.runtree.model.result;

import com.runtree.model.AttributeTable;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base of keywords and control structures: a status-carrying body item that owns a {@link Body}.
 *
 * @param <T> the concrete model type
 */
public abstract class StatusItem<T extends StatusItem<T>> extends StatusObject<T> implements BodyItem, ItemParent {

    private ItemParent parent;
    private Body body;

    protected StatusItem(Set<ItemType> bodyTypes) {
        this.body = new Body(this, bodyTypes);
    }

    @Override
    public ItemParent getParent() {
        return parent;
    }

    @Override
    public void setParent(ItemParent parent) {
        this.parent = parent;
    }

    public Body getBody() {
        return body;
    }

    /** Replaces the body with the given items or item dictionaries. */
    public void setBody(List<?> items) {
        body.replaceWith(items);
    }

    /** {@code <parent id>-k<n>}, where n is the position among the parent's steps. */
    @Override
    public String getId() {
        return stepId(this, parent);
    }

    @Override
    public List<BodyItem> getSteps() {
        return body.getSteps();
    }

    @Override
    public List<Message> getMessages() {
        return body.getMessages();
    }

    @Override
    protected void copyStateDeeply() {
        super.copyStateDeeply();
        body = body.deepCopy(this);
    }

    /** Writes {@code type} first; subclasses then add their own fields. */
    protected Map<String, Object> startDict(Map<String, Object> data) {
        data.put("type", getType().getValue());
        return data;
    }

    /** Appends status data and a non-empty body. */
    protected Map<String, Object> finishDict(Map<String, Object> data) {
        putStatusData(data);
        if (!body.isEmpty()) {
            data.put("body", body.toDicts());
        }
        return data;
    }

    @Override
    protected boolean includeInRepr(String name, Object value) {
        if (value == null) return false;
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        if (value instanceof Tags tags) return !tags.isEmpty();
        return true;
    }

    protected static <T extends StatusItem<T>> AttributeTable.Builder<T> bodyAttribute(AttributeTable.Builder<T> builder) {
        return builder.add("body", StatusItem::getBody, StatusItem::setBody, ResultCoercions.ITEMS);
    }

    static String stepId(BodyItem item, ItemParent parent) {
        if (parent == null) return "k1";
        List<BodyItem> steps = parent.getSteps();
        int index = indexOf(steps, item);
        String prefix = parent.getId() == null ? "" : parent.getId() + "-";
        return prefix + "k" + ((index < 0 ? steps.size() : index) + 1);
    }

    static int indexOf(List<?> items, Object item) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == item) return i;
        }
        return -1;
    }
}
