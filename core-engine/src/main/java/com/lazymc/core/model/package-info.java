/**
 * The resolved configuration tree.
 *
 * <p>
 * {@link com.lazymc.core.model.Config} is the root; each TOML table maps to
 * one immutable section class with a nested builder that holds the section
 * defaults. Both the file decoder and the environment decoder fill the same
 * builders, so a field has the same default whichever source is used.
 * </p>
 *
 * @since 1.0.0
 */
package com.lazymc.core.model;
