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
 * What a backend, or the adapter on behalf of all backends, reports.
 */
public class SolveOutcome
{
        public final SolveStatus status;
        public final String solver; // Backend that produced the outcome, or null.
        public final double[] values; // Variable values when OPTIMAL, otherwise null.
        public final double objective; // Objective value when OPTIMAL, otherwise NaN.
        public final String message;

        public SolveOutcome(SolveStatus status, String solver, double[] values, double objective, String message)
        {
                assert((status == SolveStatus.OPTIMAL) == (values != null));
                this.status = status;
                this.solver = solver;
                this.values = values;
                this.objective = objective;
                this.message = message;
        }

        public static SolveOutcome optimal(String solver, double[] values, double objective)
        {
                return new SolveOutcome(SolveStatus.OPTIMAL, solver, values, objective, null);
        }

        public static SolveOutcome of(SolveStatus status, String solver, String message)
        {
                return new SolveOutcome(status, solver, null, Double.NaN, message);
        }

        public String toString()
        {
                return status + (solver == null ? "" : " (" + solver + ")") + (message == null ? "" : ": " + message);
        }
}
