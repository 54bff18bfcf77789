/**
 * Command line entry point that resolves the configuration and turns fatal
 * configuration errors into an operator-facing report and exit status.
 *
 * <p>
 * Main class: {@link com.lazymc.launcher.LazymcLauncher}
 * </p>
 *
 * @since 1.0.0
 */
package com.lazymc.launcher;
