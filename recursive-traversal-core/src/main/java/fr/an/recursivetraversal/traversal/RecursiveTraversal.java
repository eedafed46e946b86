package fr.an.recursivetraversal.traversal;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

import fr.an.recursivetraversal.api.NodeCursor;
import fr.an.recursivetraversal.api.RecursiveNode;
import fr.an.recursivetraversal.api.TraversalMode;
import fr.an.recursivetraversal.traversal.TraversalParams.TraversalParamsBuilder;
import lombok.Getter;
import lombok.val;
import lombok.extern.slf4j.Slf4j;

/**
 * flattens a RecursiveNode tree into a NodeCursor, in LEAVES_ONLY, SELF_FIRST or CHILD_FIRST order
 *
 * <p>
 * The traversal keeps one frame per depth. Each frame remembers, in its FrameState,
 * what remains to be done for the current position of its node: emit it, descend into it,
 * or advance. The three modes share the same <code>fetch()</code> loop, and only differ
 * by the order in which a container goes through SELF and CHILD.
 * </p>
 *
 * <p>
 * rewind() must be called before the first position is available.
 * The root node is used as given (not copied); each rewind() rewinds it again.
 * </p>
 */
@Slf4j
public class RecursiveTraversal<K,V> implements NodeCursor<K,V> {

	public static enum TraversalStatus {
		UNINITIALIZED, POSITIONED, EXHAUSTED
	}

	@Getter
	private final RecursiveNode<K,V> rootNode;

	@Getter
	private final TraversalMode mode;

	@Getter
	private final int flags;

	private final TraversalFrameStack<K,V> stack = new TraversalFrameStack<>();

	@Getter
	private TraversalStatus status = TraversalStatus.UNINITIALIZED;

	private boolean inIteration;

	private final List<TraversalListener<K,V>> listeners = new ArrayList<>();

	// ------------------------------------------------------------------------

	public RecursiveTraversal(RecursiveNode<K,V> rootNode) {
		this(rootNode, TraversalParams.builder());
	}

	public RecursiveTraversal(RecursiveNode<K,V> rootNode, TraversalMode mode) {
		this(rootNode, TraversalParams.builder().mode(mode));
	}

	public RecursiveTraversal(RecursiveNode<K,V> rootNode, TraversalMode mode, int flags) {
		this(rootNode, TraversalParams.builder().mode(mode).flags(flags));
	}

	public RecursiveTraversal(RecursiveNode<K,V> rootNode, TraversalParamsBuilder params) {
		this(rootNode, params.build());
	}

	public RecursiveTraversal(RecursiveNode<K,V> rootNode, TraversalParams params) {
		Preconditions.checkArgument(rootNode != null, "root node must not be null");
		Preconditions.checkArgument(params.getMode() != null, "mode must not be null");
		this.rootNode = rootNode;
		this.mode = params.getMode();
		this.flags = params.getFlags();
		stack.setMaxDepth(params.getMaxDepth());
	}

	// ------------------------------------------------------------------------

	public void addListener(TraversalListener<K,V> listener) {
		listeners.add(listener);
	}

	public void removeListener(TraversalListener<K,V> listener) {
		listeners.remove(listener);
	}

	public int getDepth() {
		return Math.max(stack.getDepth(), 0);
	}

	public int getMaxDepth() {
		return stack.getMaxDepth();
	}

	/**
	 * @param maxDepth negative for unlimited. Used by the next descent decisions,
	 * frames already pushed are kept
	 */
	public void setMaxDepth(int maxDepth) {
		stack.setMaxDepth(maxDepth);
	}

	/** @return the node of the current frame, null before rewind() */
	public RecursiveNode<K,V> getSubNode() {
		val frame = stack.top();
		return (frame != null)? frame.getNode() : null;
	}

	/** @return the node of the frame at <code>level</code>, null if there is no such frame */
	public RecursiveNode<K,V> getSubNode(int level) {
		val frame = stack.get(level);
		return (frame != null)? frame.getNode() : null;
	}

	// implements NodeCursor
	// ------------------------------------------------------------------------

	@Override
	public boolean valid() {
		return status == TraversalStatus.POSITIONED;
	}

	@Override
	public V current() {
		return valid()? stack.top().getNode().current() : null;
	}

	@Override
	public K key() {
		return valid()? stack.top().getNode().key() : null;
	}

	@Override
	public void rewind() {
		while (stack.getDepth() > 0) {
			fireEndChildren(stack.getDepth());
			stack.pop();
		}
		if (log.isDebugEnabled()) {
			log.debug("rewind " + mode + " traversal"
					+ ((stack.getMaxDepth() >= 0)? ", maxDepth:" + stack.getMaxDepth() : "")
					+ " on " + rootNode);
		}
		stack.seed(rootNode);
		rootNode.rewind();
		this.inIteration = true;
		fireBeginIteration();
		fetch();
	}

	/**
	 * does nothing unless positioned
	 */
	@Override
	public void next() {
		if (status != TraversalStatus.POSITIONED) {
			return;
		}
		fetch();
	}

	// ------------------------------------------------------------------------

	/**
	 * move frames until a position is emitted, or the root frame is exhausted
	 */
	protected void fetch() {
		for(;;) {
			val frame = stack.top();
			val node = frame.getNode();
			switch (frame.getState()) {
			case NEXT:
				node.next();
				frame.setState(FrameState.START);
				// fall through
			case START:
				if (! node.valid()) {
					break;
				}
				frame.setState(FrameState.TEST);
				// fall through
			case TEST:
				if (callHasChildren()) {
					if (! stack.exceedsMaxDepth()) {
						frame.setState(mode.isEmitBeforeChildren()? FrameState.SELF : FrameState.CHILD);
						continue;
					}
					if (log.isDebugEnabled()) {
						log.debug("maxDepth " + stack.getMaxDepth() + " reached, no descent into " + node.key());
					}
				}
				frame.setState(FrameState.NEXT);
				emit();
				return;
			case SELF:
				frame.setState(mode.isEmitBeforeChildren()? FrameState.CHILD : FrameState.NEXT);
				emit();
				return;
			case CHILD: {
				final RecursiveNode<K,V> children;
				try {
					children = callGetChildren();
				} catch(RuntimeException ex) {
					// the container was never emitted: leave no position behind, and no retry on next()
					this.status = TraversalStatus.EXHAUSTED;
					this.inIteration = false;
					log.debug("failed to get children of " + node.key() + ", traversal stopped");
					throw ex;
				}
				frame.setState(mode.isEmitAfterChildren()? FrameState.SELF : FrameState.NEXT);
				stack.push(children);
				children.rewind();
				fireBeginChildren(stack.getDepth());
				continue;
			}
			default:
				throw new IllegalStateException("unexpected frame state " + frame.getState());
			}

			// frame exhausted
			if (stack.getDepth() > 0) {
				fireEndChildren(stack.getDepth());
				stack.pop();
			} else {
				this.status = TraversalStatus.EXHAUSTED;
				if (inIteration) {
					this.inIteration = false;
					fireEndIteration();
				}
				return;
			}
		}
	}

	protected void emit() {
		this.status = TraversalStatus.POSITIONED;
		for(val listener : listeners) {
			listener.nextElement(this);
		}
	}

	/** can be overridden to change which positions are descended into */
	protected boolean callHasChildren() {
		return stack.top().getNode().hasChildren();
	}

	/** can be overridden to wrap or replace children nodes */
	protected RecursiveNode<K,V> callGetChildren() {
		return stack.top().getNode().getChildren();
	}

	// ------------------------------------------------------------------------

	private void fireBeginIteration() {
		for(val listener : listeners) {
			listener.beginIteration(this);
		}
	}

	private void fireEndIteration() {
		for(val listener : listeners) {
			listener.endIteration(this);
		}
	}

	private void fireBeginChildren(int depth) {
		for(val listener : listeners) {
			listener.beginChildren(this, depth);
		}
	}

	private void fireEndChildren(int depth) {
		for(val listener : listeners) {
			listener.endChildren(this, depth);
		}
	}

	@Override
	public String toString() {
		return "RecursiveTraversal [" + mode + ", " + status + ", depth:" + getDepth() + "]";
	}

}
