/**
 * Abstract description of the parameters a service accepts, rooted at
 * {@link works.wireparams.shape.ParamType}.
 * <p>
 * Trees are built with the combinators in {@link works.wireparams.shape.ParamTypes},
 * which reject malformed shapes as soon as they are constructed.
 * Nothing in this package knows about the wire format;
 * that's the job of {@link works.wireparams.codec}.
 */
package works.wireparams.shape;
