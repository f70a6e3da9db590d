package works.wireparams;

/**
 * The point where the user clicked on an image input.
 * Sent by the browser as the parameters {@code name.x} and {@code name.y}.
 */
public record Coordinates(int abscissa, int ordinate) { }
