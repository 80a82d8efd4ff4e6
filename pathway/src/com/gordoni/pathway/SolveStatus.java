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
 * Normalized result of a solve attempt.
 */
public enum SolveStatus
{
        OPTIMAL,
        INFEASIBLE, // The targets can not be met within the caps, ramps and links given.
        UNBOUNDED,
        TIMED_OUT, // The time limit passed before a solution was found.
        CANCELLED,
        SOLVER_UNAVAILABLE // No backend could be invoked or none produced a result.
}
