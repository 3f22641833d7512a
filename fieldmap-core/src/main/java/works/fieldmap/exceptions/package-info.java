/**
 * Exceptions thrown when the mapper is misused or a field can't be reached.
 * Lookups that simply find nothing are not exceptional and don't throw.
 */
package works.fieldmap.exceptions;
