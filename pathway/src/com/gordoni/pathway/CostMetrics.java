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
 * Whole horizon cost totals of a pathway.
 */
public class CostMetrics
{
        public final double discounted_cost; // Technology cost discounted to the base year, excluding shortfall penalty.
        public final double undiscounted_cost;
        public final double penalty_cost; // Discounted shortfall penalty.
        public final double total_abatement;
        public final double cost_per_abatement; // Undiscounted cost per unit abated, NaN when nothing is abated.

        public CostMetrics(double discounted_cost, double undiscounted_cost, double penalty_cost, double total_abatement)
        {
                this.discounted_cost = discounted_cost;
                this.undiscounted_cost = undiscounted_cost;
                this.penalty_cost = penalty_cost;
                this.total_abatement = total_abatement;
                this.cost_per_abatement = total_abatement > 0 ? undiscounted_cost / total_abatement : Double.NaN;
        }
}
