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
 * A linear programming solver.
 *
 * solve() reports SOLVER_UNAVAILABLE when the backend can not be used or
 * fails without reaching a conclusion, so that the next backend may be tried.
 */
abstract class LpBackend
{
        abstract String name();

        abstract boolean available();

        abstract SolveOutcome solve(LinearProgram lp, SolveControl control);

        public static LpBackend factory(String name, Config config)
        {
                if (name.equals("simplex"))
                        return new SimplexBackend(config);
                else if (name.equals("glop"))
                        return new GlopBackend(config);
                else
                        return null;
        }
}
