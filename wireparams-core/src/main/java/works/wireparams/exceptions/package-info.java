/**
 * Everything thrown here extends {@link works.wireparams.exceptions.ParamException}.
 */
package works.wireparams.exceptions;
