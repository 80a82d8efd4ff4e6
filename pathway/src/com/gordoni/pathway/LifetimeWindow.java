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
 * Whether capacity is still in service in the year its age equals the lifetime.
 */
public enum LifetimeWindow
{
        EXCLUSIVE, // In service while 0 <= age < lifetime.
        INCLUSIVE; // In service while 0 <= age <= lifetime.

        public boolean in_service(int age, int lifetime)
        {
                if (age < 0)
                        return false;
                return this == EXCLUSIVE ? age < lifetime : age <= lifetime;
        }

        public static LifetimeWindow parse(String s)
        {
                if (s.equals("exclusive"))
                        return EXCLUSIVE;
                else if (s.equals("inclusive"))
                        return INCLUSIVE;
                else
                        throw new IllegalArgumentException("Unknown lifetime_window " + s);
        }
}
