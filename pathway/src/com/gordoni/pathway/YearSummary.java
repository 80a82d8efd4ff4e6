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
 * System totals for one model year.
 */
public class YearSummary
{
        public final int year;
        public final double target; // Emission ceiling.
        public final double required; // Required abatement.
        public final double achieved; // Total abatement.
        public final double shortfall;
        public final double remaining_emissions; // Baseline emissions less achieved abatement.
        public final double annual_cost; // Undiscounted technology cost.
        private final double[] residual_activity; // Band activity not taken over by technologies, in band order.

        public YearSummary(int year, double target, double required, double achieved, double shortfall, double remaining_emissions, double annual_cost, double[] residual_activity)
        {
                this.year = year;
                this.target = target;
                this.required = required;
                this.achieved = achieved;
                this.shortfall = shortfall;
                this.remaining_emissions = remaining_emissions;
                this.annual_cost = annual_cost;
                this.residual_activity = residual_activity.clone();
        }

        public double[] residual_activity()
        {
                return residual_activity.clone();
        }

        public double residual_activity(int band)
        {
                return residual_activity[band];
        }

        public boolean target_met(double tolerance)
        {
                return achieved >= required - tolerance * Math.max(1, required);
        }
}
