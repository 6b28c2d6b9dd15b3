package org.lokray.astkit.ast;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class of every AST element.
 * <p>
 * Each kind declares its slots through {@link #getSlots()}; the declaration order is the order in which
 * visitors walk the children. Ownership goes from parent to child only: the back reference to the parent
 * is weak and is updated whenever a visitable slot is assigned.
 */
public abstract class Node
{
	private static final AtomicLong ID_SEQUENCE = new AtomicLong();

	private final long id;
	private final boolean root;
	private final Map<String, Object> values = new HashMap<>();
	private WeakReference<Node> parent;
	private String parentKey;
	private NodeMetadata metadata = new NodeMetadata();
	private int position = -1;
	private int endPosition = -1;

	protected Node()
	{
		this(false);
	}

	protected Node(boolean root)
	{
		this.id = ID_SEQUENCE.incrementAndGet();
		this.root = root;
	}

	/**
	 * Slots of this kind, in declaration order.
	 */
	public abstract List<Slot> getSlots();

	/**
	 * A new node of the same kind with every slot empty. Used by {@link #copy(Node)}.
	 */
	protected abstract Node newInstance();

	/**
	 * Kind name used for handler dispatch.
	 */
	public String getKind()
	{
		return getClass().getSimpleName();
	}

	public long getId()
	{
		return id;
	}

	public boolean isRoot()
	{
		return root;
	}

	public Slot getSlot(String name)
	{
		for (Slot slot : getSlots())
		{
			if (slot.getName().equals(name))
			{
				return slot;
			}
		}
		throw new IllegalArgumentException(getKind() + " has no slot named '" + name + "'");
	}

	public boolean hasSlot(String name)
	{
		for (Slot slot : getSlots())
		{
			if (slot.getName().equals(name))
			{
				return true;
			}
		}
		return false;
	}

	public List<Child> children()
	{
		List<Child> ret = new ArrayList<>();
		for (Slot slot : getSlots())
		{
			ret.add(new Child(slot, get(slot.getName())));
		}
		return ret;
	}

	/**
	 * Current value of a slot. Sequences are returned as read-only views; use {@link #set(String, Object)}
	 * to change them.
	 */
	public Object get(String name)
	{
		Slot slot = getSlot(name);
		Object value = values.get(name);
		if (slot.isSequence() && value == null)
		{
			return Collections.emptyList();
		}
		if (value instanceof List<?> list)
		{
			return Collections.unmodifiableList(list);
		}
		return value;
	}

	public Node getNode(String name)
	{
		Object value = get(name);
		return value instanceof Node node ? node : null;
	}

	@SuppressWarnings("unchecked")
	public <T> List<T> getList(String name)
	{
		Object value = get(name);
		if (value instanceof List<?> list)
		{
			return (List<T>) list;
		}
		return value == null ? Collections.emptyList() : (List<T>) List.of(value);
	}

	public String getString(String name)
	{
		Object value = get(name);
		return value == null ? null : value.toString();
	}

	/**
	 * Assigns a slot. Nodes placed in a visitable slot are re-parented to this node under the slot name;
	 * nodes that were held by the slot before and still point back at it are detached.
	 *
	 * @throws TypeMismatchException    if the slot is typed and the value does not conform
	 * @throws IllegalArgumentException if the slot does not exist
	 */
	public void set(String name, Object value)
	{
		Slot slot = getSlot(name);
		if (!slot.accepts(value))
		{
			throw new TypeMismatchException(getKind(), slot, value);
		}
		Object stored = value instanceof List<?> list ? new ArrayList<>(list) : value;

		if (slot.isVisitable())
		{
			forEachNode(values.get(name), old ->
			{
				if (old.parentRef() == this && name.equals(old.parentKey))
				{
					old.detach();
				}
			});
			forEachNode(stored, child -> child.attachTo(this, name));
		}
		values.put(name, stored);
	}

	/**
	 * Parent of this node, or null for an orphan.
	 *
	 * @throws RootNodeException if this is a root node
	 */
	public Node getParent()
	{
		if (root)
		{
			throw new RootNodeException(this);
		}
		return parentRef();
	}

	/**
	 * Sets the parent without touching any slot of the parent. Ignored on root nodes.
	 */
	public void setParent(Node parent)
	{
		if (root)
		{
			return;
		}
		this.parent = parent == null ? null : new WeakReference<>(parent);
	}

	public String getParentKey()
	{
		return parentKey;
	}

	public NodeMetadata getMetadata()
	{
		return metadata;
	}

	public int getPosition()
	{
		return position;
	}

	public int getEndPosition()
	{
		return endPosition;
	}

	public boolean hasPosition()
	{
		return position >= 0;
	}

	public void setPosition(int position, int endPosition)
	{
		this.position = position;
		this.endPosition = endPosition;
	}

	/**
	 * Deep copy. Every node of the copy is new, visitable children are copied recursively and re-linked
	 * within the copy, non-visitable values are shared. The copy is flagged in its metadata along with the
	 * span of the original.
	 *
	 * @param newParent parent to set on the copy, or null
	 */
	public Node copy(Node newParent)
	{
		Node ret = newInstance();
		for (Slot slot : getSlots())
		{
			Object value = values.get(slot.getName());
			if (value == null)
			{
				continue;
			}
			if (!slot.isVisitable())
			{
				ret.values.put(slot.getName(), value instanceof List<?> list ? new ArrayList<>(list) : value);
				continue;
			}
			if (value instanceof Node child)
			{
				ret.set(slot.getName(), child.copy(null));
			}
			else if (value instanceof List<?> list)
			{
				List<Object> copied = new ArrayList<>(list.size());
				for (Object element : list)
				{
					copied.add(element instanceof Node child ? child.copy(null) : element);
				}
				ret.set(slot.getName(), copied);
			}
			else
			{
				ret.set(slot.getName(), value);
			}
		}
		ret.metadata = metadata.copyOf(position, endPosition);
		ret.setParent(newParent);
		return ret;
	}

	/**
	 * Recursively empties the subtree below this node and severs every parent link in it.
	 */
	public void teardown()
	{
		for (Slot slot : getSlots())
		{
			if (slot.isVisitable())
			{
				forEachNode(values.get(slot.getName()), Node::teardown);
			}
		}
		values.clear();
		detach();
	}

	public String describe()
	{
		return getKind() + "#" + id;
	}

	@Override
	public String toString()
	{
		return describe();
	}

	private Node parentRef()
	{
		return parent == null ? null : parent.get();
	}

	private void attachTo(Node owner, String key)
	{
		setParent(owner);
		parentKey = key;
	}

	private void detach()
	{
		parent = null;
		parentKey = null;
	}

	private static void forEachNode(Object value, java.util.function.Consumer<Node> action)
	{
		if (value instanceof Node node)
		{
			action.accept(node);
		}
		else if (value instanceof List<?> list)
		{
			for (Object element : list)
			{
				if (element instanceof Node node)
				{
					action.accept(node);
				}
			}
		}
	}
}
