package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.ModelJson;
import com.runtree.model.ModelObject;
import com.runtree.model.Timestamps;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A log message. Leaf: no body, no status.
 */
public final class Message extends ModelObject<Message> implements BodyItem {

    private static final AttributeTable<Message> ATTRIBUTES = AttributeTable.<Message>builder("Message")
            .readOnly("type", Message::getType, ResultCoercions.ITEM_TYPE)
            .add("message", Message::getMessage, Message::setMessage, Coercions.STRING)
            .add("level", Message::getLevel, Message::setLevel, ResultCoercions.LEVEL)
            .add("html", Message::isHtml, Message::setHtml, Coercions.BOOLEAN)
            .add("timestamp", Message::getTimestamp, Message::setTimestamp, Coercions.DATE_TIME)
            .build();

    private ItemParent parent;
    private String message = "";
    private MessageLevel level = MessageLevel.INFO;
    private boolean html;
    private LocalDateTime timestamp;

    public Message() {
    }

    public Message(String message, MessageLevel level) {
        setMessage(message);
        setLevel(level);
    }

    public static Message fromDict(Map<String, ?> data) {
        return fromDict(Message::new, data);
    }

    public static Message fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Message fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Message> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.MESSAGE;
    }

    @Override
    public ItemParent getParent() {
        return parent;
    }

    @Override
    public void setParent(ItemParent parent) {
        this.parent = parent;
    }

    /** {@code <parent id>-m<n>}, where n is the position among the parent's messages. */
    @Override
    public String getId() {
        if (parent == null) return "m1";
        List<Message> messages = parent.getMessages();
        int index = StatusItem.indexOf(messages, this);
        return parent.getId() + "-m" + ((index < 0 ? messages.size() : index) + 1);
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message != null ? message : "";
    }

    public MessageLevel getLevel() {
        return level;
    }

    public void setLevel(MessageLevel level) {
        this.level = level != null ? level : MessageLevel.INFO;
    }

    public boolean isHtml() {
        return html;
    }

    public void setHtml(Boolean html) {
        this.html = Boolean.TRUE.equals(html);
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", getType().getValue());
        data.put("message", message);
        data.put("level", level.name());
        if (html) {
            data.put("html", true);
        }
        if (timestamp != null) {
            data.put("timestamp", Timestamps.format(timestamp));
        }
        return data;
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("message", "level");
    }
}
