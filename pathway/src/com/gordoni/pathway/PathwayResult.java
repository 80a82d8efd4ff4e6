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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of one run.
 *
 * Only OPTIMAL results carry records and year summaries. An INFEASIBLE result
 * lists the years in which the deployable abatement is known to fall short of
 * the requirement; the list may be empty when the infeasibility arises from
 * links between technologies.
 */
public class PathwayResult
{
        public final SolveStatus status;
        public final String solver;
        public final String message;
        public final double objective; // Discounted total cost including shortfall penalty. NaN unless OPTIMAL.
        public final double penalty; // Shortfall penalty per unit used.
        public final List<TechYearResult> records;
        public final List<YearSummary> years;
        public final List<Integer> infeasible_years;

        public PathwayResult(SolveStatus status, String solver, String message, double objective, double penalty, List<TechYearResult> records, List<YearSummary> years,
                List<Integer> infeasible_years)
        {
                this.status = status;
                this.solver = solver;
                this.message = message;
                this.objective = objective;
                this.penalty = penalty;
                this.records = Collections.unmodifiableList(new ArrayList<TechYearResult>(records));
                this.years = Collections.unmodifiableList(new ArrayList<YearSummary>(years));
                this.infeasible_years = Collections.unmodifiableList(new ArrayList<Integer>(infeasible_years));
        }

        public static PathwayResult unsolved(SolveOutcome outcome, double penalty, List<Integer> infeasible_years)
        {
                return new PathwayResult(outcome.status, outcome.solver, outcome.message, Double.NaN, penalty, Collections.<TechYearResult>emptyList(),
                        Collections.<YearSummary>emptyList(), infeasible_years);
        }

        public boolean optimal()
        {
                return status == SolveStatus.OPTIMAL;
        }

        public TechYearResult record(String tech_id, int year)
        {
                for (TechYearResult r : records)
                        if (r.tech_id.equals(tech_id) && r.year == year)
                                return r;
                return null;
        }

        public List<TechYearResult> records_for(String tech_id)
        {
                List<TechYearResult> res = new ArrayList<TechYearResult>();
                for (TechYearResult r : records)
                        if (r.tech_id.equals(tech_id))
                                res.add(r);
                return res;
        }

        public YearSummary year(int year)
        {
                for (YearSummary y : years)
                        if (y.year == year)
                                return y;
                return null;
        }

        public double shortfall(int year)
        {
                YearSummary y = year(year);
                return y == null ? 0 : y.shortfall;
        }

        public double total_shortfall()
        {
                double total = 0;
                for (YearSummary y : years)
                        total += y.shortfall;
                return total;
        }

        public CostMetrics cost_metrics()
        {
                double discounted = 0;
                double undiscounted = 0;
                double abatement = 0;
                for (TechYearResult r : records)
                {
                        discounted += r.discounted_cost();
                        undiscounted += r.annual_cost();
                        abatement += r.abatement;
                }
                double penalty_cost = optimal() ? Math.max(0, objective - discounted) : 0;
                return new CostMetrics(discounted, undiscounted, penalty_cost, abatement);
        }

        public String toString()
        {
                return "PathwayResult(" + status + (solver == null ? "" : ", " + solver) + (optimal() ? ", objective=" + objective : "") + ")";
        }
}
