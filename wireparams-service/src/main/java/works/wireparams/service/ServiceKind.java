package works.wireparams.service;

public enum ServiceKind {
	/**
	 * Identified by its path alone; has a stable, bookmarkable URL.
	 */
	PUBLIC,

	/**
	 * Shares the path of a public fallback service and is told apart by a
	 * state code sent in {@link Services#STATE_PARAM}.
	 */
	AUXILIARY,

	/**
	 * Lives on another site. Can be linked to but never registered.
	 */
	EXTERNAL,
}
