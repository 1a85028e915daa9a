/**
 * The {@code core} package holds the metadata of registered classes
 * and the registry that publishes it. A {@link MetaClass} answers
 * queries about the members and bases of one class, and casts views of
 * its instances ({@link UserObject}) across the hierarchy.
 * <p>
 * Classes are declared through a {@link ClassBuilder} obtained from a
 * {@link ClassRegistry}, and are immutable once published.
 */
package uk.co.farowl.rtmeta.core;
