// file: core/src/main/java/io/kvgate/core/OpResponse.java
package io.kvgate.core;

/**
 * Typed result of one operation, either standalone or inside a transaction branch.
 */
public sealed interface OpResponse permits Revision, Deleted, Range {

    Header header();
}
