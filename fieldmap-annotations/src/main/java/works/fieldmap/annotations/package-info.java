/**
 * Annotations through which classes declare how their fields are named and composed.
 */
package works.fieldmap.annotations;
