/**
 * Configuration version parsing and compatibility classification.
 *
 * @since 1.0.0
 */
package com.lazymc.core.version;
