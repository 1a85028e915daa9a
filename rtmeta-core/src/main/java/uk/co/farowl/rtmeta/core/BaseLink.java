// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.core;

/**
 * A direct base of a {@link MetaClass}: the id of the base (its slot in
 * the owning {@link ClassRegistry}) and the byte offset to add to a
 * pointer to the derived class to view it as the base. The link does
 * not own the base.
 *
 * @param baseId id of the base class in the registry
 * @param offset byte delta from the derived view to the base view
 */
record BaseLink(int baseId, int offset) {}
