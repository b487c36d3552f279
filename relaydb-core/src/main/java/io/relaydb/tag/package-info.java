/**
 * Tag extraction from event content and the lossless hex-packing rule for tag values.
 *
 * @see io.relaydb.tag.TagExtractor
 * @see io.relaydb.tag.TagValue
 */
package io.relaydb.tag;
