package com.runtree.model.result;

import com.runtree.model.DataException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Errors and warnings reported during execution but not tied to any test or keyword.
 */
public final class ExecutionErrors implements ItemParent, Iterable<Message> {

    private final List<Message> messages = new ArrayList<>();

    @Override
    public String getId() {
        return "errors";
    }

    @Override
    public List<BodyItem> getSteps() {
        return List.of();
    }

    @Override
    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public Message createMessage(Map<String, ?> data) {
        Message message = new Message();
        message.setParent(this);
        message.config(data);
        messages.add(message);
        return message;
    }

    public Message add(Message message) {
        message.setParent(this);
        messages.add(message);
        return message;
    }

    /** Replaces all messages with the given messages or message dictionaries. */
    public ExecutionErrors replaceWith(List<?> items) {
        List<?> snapshot = new ArrayList<>(items);
        messages.clear();
        for (Object item : snapshot) {
            if (item instanceof Message message) {
                add(message);
            } else if (item instanceof Map<?, ?> data) {
                createMessage(Body.asData(data));
            } else {
                throw new DataException("Errors must be messages or dictionaries, got '" + item + "'.");
            }
        }
        return this;
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    @Override
    public Iterator<Message> iterator() {
        return getMessages().iterator();
    }

    public List<Map<String, Object>> toDicts() {
        List<Map<String, Object>> dicts = new ArrayList<>(messages.size());
        for (Message message : messages) {
            dicts.add(message.toDict());
        }
        return dicts;
    }

    ExecutionErrors deepCopy() {
        ExecutionErrors copy = new ExecutionErrors();
        for (Message message : messages) {
            copy.add(message.deepCopy());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "ExecutionErrors(messages=" + messages.size() + ")";
    }
}
