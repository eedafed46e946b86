package fr.an.recursivetraversal.traversal;

import fr.an.recursivetraversal.api.TraversalMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Builder
@AllArgsConstructor
public class TraversalParams {

	@Builder.Default
	@Getter
	private TraversalMode mode = TraversalMode.LEAVES_ONLY;

	/** reserved for node specific rendering flags, stored but not interpreted by the traversal */
	@Builder.Default
	@Getter
	private int flags = 0;

	/** -1 for unlimited */
	@Builder.Default
	@Getter
	private int maxDepth = -1;

}
