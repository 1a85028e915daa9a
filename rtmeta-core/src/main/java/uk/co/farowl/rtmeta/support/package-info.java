/**
 * The {@code support} package contains the exceptions thrown by the
 * metadata API. All of them are unchecked and extend
 * {@link MetaError}.
 */
package uk.co.farowl.rtmeta.support;
