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
 * Lifecycle of a planner. BUILT once the model is assembled, SOLVING while a backend runs, then one of the final states.
 */
public enum RunState
{
        BUILT,
        SOLVING,
        OPTIMAL,
        INFEASIBLE,
        UNBOUNDED,
        TIMED_OUT,
        SOLVER_UNAVAILABLE,
        CANCELLED;

        public static RunState of(SolveStatus status)
        {
                switch (status)
                {
                case OPTIMAL:
                        return OPTIMAL;
                case INFEASIBLE:
                        return INFEASIBLE;
                case UNBOUNDED:
                        return UNBOUNDED;
                case TIMED_OUT:
                        return TIMED_OUT;
                case CANCELLED:
                        return CANCELLED;
                case SOLVER_UNAVAILABLE:
                        return SOLVER_UNAVAILABLE;
                default:
                        throw new IllegalArgumentException("Unknown status " + status);
                }
        }

        public boolean terminal()
        {
                return this != BUILT && this != SOLVING;
        }
}
