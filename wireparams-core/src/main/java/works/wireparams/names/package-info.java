/**
 * Field names for building forms, mirroring the structure of a
 * {@link works.wireparams.shape.ParamType ParamType}.
 * Obtained from {@link works.wireparams.names.ParamNames#of}.
 */
package works.wireparams.names;
