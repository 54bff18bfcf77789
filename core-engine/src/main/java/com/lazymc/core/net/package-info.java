/**
 * Socket address parsing and hostname resolution for address-bearing
 * configuration fields.
 *
 * @since 1.0.0
 */
package com.lazymc.core.net;
