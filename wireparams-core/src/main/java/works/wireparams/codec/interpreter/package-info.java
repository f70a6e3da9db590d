/**
 * Implements {@link works.wireparams.codec.ParamCodec ParamCodec} directly by walking
 * a given {@link works.wireparams.shape.ParamType ParamType} tree
 * and performing the indicated operations.
 */
package works.wireparams.codec.interpreter;
