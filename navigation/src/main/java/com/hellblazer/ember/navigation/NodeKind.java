/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.ember.navigation;

/**
 * Classification of a navigable cell.
 *
 * @author hal.hildebrand
 */
public enum NodeKind {
    /** Ordinary cell on a level */
    FLOOR_CELL,
    /** Cell inside the stairway region, linked vertically to the cells above and below */
    STAIR_CELL,
    /** Ground-level border cell leading out of the structure */
    EXIT
}
