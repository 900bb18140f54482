// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util.condition;

/**
 * A message computed only when somebody asks for it.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
