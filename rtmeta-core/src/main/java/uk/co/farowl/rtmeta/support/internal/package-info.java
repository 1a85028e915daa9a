/**
 * The {@code support.internal} package contains helpers used across
 * the implementation. Classes {@code public} here are not intended for
 * client programs.
 */
package uk.co.farowl.rtmeta.support.internal;
