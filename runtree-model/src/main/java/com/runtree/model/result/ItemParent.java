package com.runtree.model.result;

import java.util.List;

/**
 * Anything body items and messages can be attached to. Child ids are derived from the
 * parent's id and the child's position in {@link #getSteps()} or {@link #getMessages()}.
 */
public interface ItemParent {

    String getId();

    /** Setup, non-message body items and teardown, in execution order. */
    List<BodyItem> getSteps();

    /** Messages logged directly under this parent. */
    List<Message> getMessages();
}
