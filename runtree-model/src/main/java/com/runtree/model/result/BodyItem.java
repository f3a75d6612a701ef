package com.runtree.model.result;

import java.util.Map;

/**
 * An entry in a {@link Body}: a keyword, a control structure or a message.
 * Implementations are {@link com.runtree.model.ModelObject}s.
 */
public interface BodyItem {

    ItemType getType();

    /** Non-owning back reference used for id computation; null for a detached item. */
    ItemParent getParent();

    void setParent(ItemParent parent);

    String getId();

    Map<String, Object> toDict();
}
