package com.runtree.model.result;

import com.runtree.model.DataException;
import com.runtree.model.ModelObject;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered children of a test, keyword or control structure.
 *
 * <p>Items are created through the factory methods ({@code createKeyword}, {@code createFor},
 * ...) so that handlers do not need to know which kind of parent they are populating. Each body
 * permits a fixed set of item types; creating or adding anything else fails with a
 * {@link DataException}. Every item added gets the owner as its parent.
 */
public final class Body extends AbstractList<BodyItem> {

    /** Tests, keywords, iterations, groups and branches. */
    public static final Set<ItemType> STEPS = Collections.unmodifiableSet(EnumSet.of(
            ItemType.KEYWORD, ItemType.FOR, ItemType.WHILE, ItemType.GROUP, ItemType.IF_ELSE_ROOT,
            ItemType.TRY_EXCEPT_ROOT, ItemType.VAR, ItemType.RETURN, ItemType.CONTINUE, ItemType.BREAK,
            ItemType.ERROR, ItemType.MESSAGE));

    /** FOR and WHILE loops. Keywords and messages appear here in reports of failed loops. */
    public static final Set<ItemType> ITERATIONS = Collections.unmodifiableSet(EnumSet.of(
            ItemType.ITERATION, ItemType.KEYWORD, ItemType.MESSAGE));

    public static final Set<ItemType> IF_BRANCHES = Collections.unmodifiableSet(EnumSet.of(
            ItemType.IF, ItemType.ELSE_IF, ItemType.ELSE, ItemType.KEYWORD, ItemType.MESSAGE));

    public static final Set<ItemType> TRY_BRANCHES = Collections.unmodifiableSet(EnumSet.of(
            ItemType.TRY, ItemType.EXCEPT, ItemType.ELSE, ItemType.FINALLY, ItemType.KEYWORD, ItemType.MESSAGE));

    /** VAR, RETURN, CONTINUE, BREAK and ERROR: only keywords run while evaluating them and messages. */
    public static final Set<ItemType> LEAF = Collections.unmodifiableSet(EnumSet.of(
            ItemType.KEYWORD, ItemType.MESSAGE));

    private final ItemParent owner;
    private final Set<ItemType> allowed;
    private final List<BodyItem> items = new ArrayList<>();

    public Body(ItemParent owner, Set<ItemType> allowed) {
        this.owner = owner;
        this.allowed = allowed;
    }

    public ItemParent getOwner() {
        return owner;
    }

    public Set<ItemType> getAllowedTypes() {
        return allowed;
    }

    @Override
    public BodyItem get(int index) {
        return items.get(index);
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public void add(int index, BodyItem item) {
        requireAllowed(item.getType());
        item.setParent(owner);
        items.add(index, item);
    }

    @Override
    public BodyItem set(int index, BodyItem item) {
        requireAllowed(item.getType());
        item.setParent(owner);
        return items.set(index, item);
    }

    @Override
    public BodyItem remove(int index) {
        return items.remove(index);
    }

    public Keyword createKeyword() {
        return createKeyword(Map.of());
    }

    public Keyword createKeyword(Map<String, ?> data) {
        return create(new Keyword(ItemType.KEYWORD), data);
    }

    public For createFor() {
        return createFor(Map.of());
    }

    public For createFor(Map<String, ?> data) {
        return create(new For(), data);
    }

    public While createWhile() {
        return createWhile(Map.of());
    }

    public While createWhile(Map<String, ?> data) {
        return create(new While(), data);
    }

    public Iteration createIteration() {
        return createIteration(Map.of());
    }

    public Iteration createIteration(Map<String, ?> data) {
        return create(new Iteration(), data);
    }

    public Group createGroup() {
        return createGroup(Map.of());
    }

    public Group createGroup(Map<String, ?> data) {
        return create(new Group(), data);
    }

    public If createIf() {
        return createIf(Map.of());
    }

    public If createIf(Map<String, ?> data) {
        return create(new If(), data);
    }

    public Try createTry() {
        return createTry(Map.of());
    }

    public Try createTry(Map<String, ?> data) {
        return create(new Try(), data);
    }

    /** Creates an IF branch, or a TRY branch when this is the body of a {@link Try}. */
    public Branch createBranch() {
        return createBranch(Map.of());
    }

    public Branch createBranch(Map<String, ?> data) {
        return create(new Branch(owner instanceof Try ? ItemType.TRY : ItemType.IF), data);
    }

    public Var createVar() {
        return createVar(Map.of());
    }

    public Var createVar(Map<String, ?> data) {
        return create(new Var(), data);
    }

    public Return createReturn() {
        return createReturn(Map.of());
    }

    public Return createReturn(Map<String, ?> data) {
        return create(new Return(), data);
    }

    public Continue createContinue() {
        return createContinue(Map.of());
    }

    public Continue createContinue(Map<String, ?> data) {
        return create(new Continue(), data);
    }

    public Break createBreak() {
        return createBreak(Map.of());
    }

    public Break createBreak(Map<String, ?> data) {
        return create(new Break(), data);
    }

    public ErrorItem createError() {
        return createError(Map.of());
    }

    public ErrorItem createError(Map<String, ?> data) {
        return create(new ErrorItem(), data);
    }

    public Message createMessage() {
        return createMessage(Map.of());
    }

    public Message createMessage(Map<String, ?> data) {
        return create(new Message(), data);
    }

    /**
     * Creates an item from its dictionary, choosing the item class by the {@code type} key.
     * A dictionary without {@code type} is a keyword.
     */
    public BodyItem createFromDict(Map<String, ?> data) {
        Object type = data.get("type");
        ItemType itemType;
        try {
            itemType = type == null ? ItemType.KEYWORD : ResultCoercions.ITEM_TYPE.coerce(type);
        } catch (IllegalArgumentException e) {
            throw new DataException(e.getMessage(), e);
        }
        switch (itemType) {
            case KEYWORD: return createKeyword(data);
            case FOR: return createFor(data);
            case WHILE: return createWhile(data);
            case ITERATION: return createIteration(data);
            case GROUP: return createGroup(data);
            case IF_ELSE_ROOT: return createIf(data);
            case TRY_EXCEPT_ROOT: return createTry(data);
            case IF: case ELSE_IF: case ELSE: case TRY: case EXCEPT: case FINALLY: return createBranch(data);
            case VAR: return createVar(data);
            case RETURN: return createReturn(data);
            case CONTINUE: return createContinue(data);
            case BREAK: return createBreak(data);
            case ERROR: return createError(data);
            case MESSAGE: return createMessage(data);
            default:
                throw new DataException("Body item type '" + itemType + "' is not allowed in a body.");
        }
    }

    /** Replaces all items with the given items or item dictionaries. */
    public Body replaceWith(List<?> newItems) {
        List<?> snapshot = new ArrayList<>(newItems);
        items.clear();
        for (Object item : snapshot) {
            if (item instanceof BodyItem bodyItem) {
                add(bodyItem);
            } else if (item instanceof Map<?, ?> data) {
                createFromDict(asData(data));
            } else {
                throw new DataException("Body items must be body items or dictionaries, got '"
                        + (item == null ? "null" : item.getClass().getSimpleName()) + "'.");
            }
        }
        return this;
    }

    public List<Message> getMessages() {
        List<Message> messages = new ArrayList<>();
        for (BodyItem item : items) {
            if (item instanceof Message message) {
                messages.add(message);
            }
        }
        return messages;
    }

    /** Items other than messages. */
    public List<BodyItem> getSteps() {
        List<BodyItem> steps = new ArrayList<>();
        for (BodyItem item : items) {
            if (item.getType() != ItemType.MESSAGE) {
                steps.add(item);
            }
        }
        return steps;
    }

    public List<Map<String, Object>> toDicts() {
        List<Map<String, Object>> dicts = new ArrayList<>(items.size());
        for (BodyItem item : items) {
            dicts.add(item.toDict());
        }
        return dicts;
    }

    /** Deep copy of every item, re-parented to {@code newOwner}. */
    Body deepCopy(ItemParent newOwner) {
        Body copy = new Body(newOwner, allowed);
        for (BodyItem item : items) {
            copy.add((BodyItem) ((ModelObject<?>) item).deepCopy());
        }
        return copy;
    }

    private <I extends ModelObject<I> & BodyItem> I create(I item, Map<String, ?> data) {
        item.setParent(owner);
        item.config(data);
        requireAllowed(item.getType());
        items.add(item);
        return item;
    }

    private void requireAllowed(ItemType type) {
        if (!allowed.contains(type)) {
            String ownerType = owner == null ? "body" : owner.getClass().getSimpleName();
            throw new DataException("'" + ownerType + "' body does not allow type '" + type + "'.");
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, ?> asData(Map<?, ?> data) {
        return (Map<String, ?>) data;
    }
}
