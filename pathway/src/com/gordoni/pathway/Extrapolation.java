/*
 * Pathway - Technology Deployment Pathway Planner
 * Copyright (C) 2009, 2011-2017 Gordon Irlam
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.gordoni.pathway;

/**
 * How a time series is extended to years outside the range of its known values.
 */
public enum Extrapolation
{
        FLAT, // Hold the nearest known value.
        LINEAR, // Continue the slope of the nearest end segment.
        NONE; // Years outside the known range are a data gap.

        public static Extrapolation parse(String s)
        {
                if (s.equals("flat"))
                        return FLAT;
                else if (s.equals("linear"))
                        return LINEAR;
                else if (s.equals("none"))
                        return NONE;
                else
                        throw new IllegalArgumentException("Unknown extrapolation " + s);
        }
}
