/**
 * Pure Java value types shared across all Stash modules.
 *
 * <p>Enums persisted by numeric id ({@link com.libragraph.stash.types.Visibility},
 * {@link com.libragraph.stash.types.ObjectKind}). No framework dependencies.
 */
package com.libragraph.stash.types;
