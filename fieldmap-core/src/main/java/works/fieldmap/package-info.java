/**
 * Resolves logical field names to the locations of fields inside nested objects.
 * <p>
 * The major components are:
 *
 * <ul>
 *     <li>
 *         the {@link works.fieldmap.Mapper}, which caches a
 *         {@link works.fieldmap.TypeDescriptor} per class and answers name lookups;
 *     </li>
 *     <li>
 *         the {@link works.fieldmap.FieldScanner}, which builds a
 *         {@link works.fieldmap.TypeDescriptor} by walking a class's fields,
 *         guided by a {@link works.fieldmap.NamingPolicy}; and
 *     </li>
 *     <li>
 *         the {@link works.fieldmap.Accessors}, which follow a
 *         {@link works.fieldmap.Traversal} through a live object.
 *     </li>
 * </ul>
 *
 * Field names and embedding are declared with the annotations in {@link works.fieldmap.annotations}.
 */
package works.fieldmap;
