/**
 * Exceptions thrown by Tomlet. All are unchecked and descend from
 * {@link works.tomlet.exceptions.TomlException}.
 */
package works.tomlet.exceptions;
