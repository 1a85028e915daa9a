/**
 * The {@code member} package contains the members a class may declare
 * (properties and functions), its constructors, and the visitor to
 * which a class presents its members. Members are implemented by
 * method handles bound at registration.
 */
package uk.co.farowl.rtmeta.member;
