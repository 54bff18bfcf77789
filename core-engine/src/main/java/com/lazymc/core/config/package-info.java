/**
 * Configuration loading: source selection, TOML decoding, and typed
 * environment variable decoding.
 *
 * <p>
 * {@link com.lazymc.core.config.ConfigLoader} is the entry point. It picks
 * the file or the environment, never both, and reports fatal problems as
 * {@link com.lazymc.core.config.ConfigLoadException}s carrying
 * {@link com.lazymc.core.config.ErrorHint}s.
 * </p>
 *
 * @since 1.0.0
 */
package com.lazymc.core.config;
