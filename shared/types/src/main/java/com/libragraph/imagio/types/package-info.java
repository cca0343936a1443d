/**
 * Pure Java value types shared across all Imagio modules.
 *
 * <p>Holds the variant policy: which derivatives exist, how big they are
 * and how they are encoded. No framework dependencies.
 */
package com.libragraph.imagio.types;
