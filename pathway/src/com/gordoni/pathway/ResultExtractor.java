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
 * Maps an optimal solution back onto the technology and year grid.
 *
 * Before anything is reported the solved values are checked against the
 * relations the model was built to enforce. Vintaging, the production limit
 * and the mass balance ceiling are re-evaluated directly from the values, so
 * a defect in assembly or in a backend surfaces as a ModelIntegrityException
 * instead of a plausible looking pathway.
 */
public class ResultExtractor
{
        private final ModelInputs in;
        private final VintageIndex vintages;
        private final VariableLayout vars;
        private final ObjectiveBuilder objective;

        public ResultExtractor(ModelInputs in, VintageIndex vintages, VariableLayout vars, ObjectiveBuilder objective)
        {
                this.in = in;
                this.vintages = vintages;
                this.vars = vars;
                this.objective = objective;
        }

        public PathwayResult extract(SolveOutcome outcome)
        {
                assert(outcome.status == SolveStatus.OPTIMAL);

                int n = in.num_techs();
                int y = in.num_years();
                double[][] install = new double[n][y];
                double[][] capacity = new double[n][y];
                double[][] production = new double[n][y];
                double[][] abatement = new double[n][y];
                for (int i = 0; i < n; i++)
                        for (int t = 0; t < y; t++)
                        {
                                install[i][t] = outcome.values[vars.install(i, t)];
                                capacity[i][t] = outcome.values[vars.capacity(i, t)];
                                production[i][t] = outcome.values[vars.production(i, t)];
                                abatement[i][t] = outcome.values[vars.abatement(i, t)];
                        }

                check(in, vintages, install, capacity, production);

                double tol = in.config.tolerance;
                boolean stream = in.config.capital_charge.equals("stream");
                List<TechYearResult> records = new ArrayList<TechYearResult>();
                double[] achieved = new double[y];
                double[] annual_cost = new double[y];
                double[][] residual = new double[y][in.bands.size()];
                for (int t = 0; t < y; t++)
                        for (int b = 0; b < in.bands.size(); b++)
                                residual[t][b] = in.bands.get(b).activity;

                for (int i = 0; i < n; i++)
                        for (int t = 0; t < y; t++)
                        {
                                double installed = zero(install[i][t], tol);
                                double in_service = zero(capacity[i][t], tol);
                                double prod = zero(production[i][t], tol);
                                double abate = zero(abatement[i][t], tol);

                                double capital = 0;
                                if (stream)
                                {
                                        for (int tau : vintages.alive(i, t))
                                                capital += objective.crf(i) * in.capex[i][tau] * zero(install[i][tau], tol);
                                }
                                else
                                        capital = objective.crf(i) * in.capex[i][t] * installed;
                                double operating = in.operating_cost(i, t) * prod;

                                TechYearResult r = new TechYearResult(in.techs.get(i).id, in.years[t], installed, in_service, in_service / in.activity[i], prod, abate,
                                        capital, operating, objective.discount_factor(t));
                                records.add(r);

                                achieved[t] += abate;
                                annual_cost[t] += r.annual_cost();
                                residual[t][in.band_of[i]] -= prod;
                        }

                List<YearSummary> years = new ArrayList<YearSummary>();
                for (int t = 0; t < y; t++)
                {
                        double shortfall;
                        if (vars.has_slack())
                                shortfall = zero(outcome.values[vars.shortfall(t)], tol);
                        else
                                shortfall = zero(Math.max(0, in.required[t] - achieved[t]), tol);
                        for (int b = 0; b < residual[t].length; b++)
                                residual[t][b] = zero(Math.max(0, residual[t][b]), tol);
                        years.add(new YearSummary(in.years[t], in.target[t], in.required[t], achieved[t], shortfall, in.baseline - achieved[t], annual_cost[t],
                                residual[t]));
                }

                return new PathwayResult(SolveStatus.OPTIMAL, outcome.solver, outcome.message, outcome.objective, objective.penalty(), records, years,
                        Collections.<Integer>emptyList());
        }

        private static double zero(double v, double tol)
        {
                return Math.abs(v) <= tol ? 0 : v;
        }

        private static boolean exceeds(double lhs, double rhs, double tol)
        {
                return lhs - rhs > tol * Math.max(1, Math.abs(rhs));
        }

        /**
         * Throw ModelIntegrityException unless the values honor vintaging, the production limit and the mass balance ceiling.
         */
        static void check(ModelInputs in, VintageIndex vintages, double[][] install, double[][] capacity, double[][] production)
        {
                double tol = in.config.tolerance;
                for (int i = 0; i < in.num_techs(); i++)
                {
                        String id = in.techs.get(i).id;
                        double[] expected = vintages.in_service(i, install[i]);
                        for (int t = 0; t < in.num_years(); t++)
                        {
                                if (Math.abs(capacity[i][t] - expected[t]) > tol * Math.max(1, Math.abs(expected[t])))
                                        throw new ModelIntegrityException("Capacity of " + id + " in " + in.years[t] + " is " + capacity[i][t] + " but in service installations total " +
                                                expected[t]);
                                if (exceeds(production[i][t], capacity[i][t], tol))
                                        throw new ModelIntegrityException("Production of " + id + " in " + in.years[t] + " is " + production[i][t] + " exceeding capacity " +
                                                capacity[i][t]);
                        }
                }

                for (int b = 0; b < in.bands.size(); b++)
                {
                        BaselineBand band = in.bands.get(b);
                        for (int t = 0; t < in.num_years(); t++)
                        {
                                double total = 0;
                                for (int i : in.techs_in_band(b))
                                        total += production[i][t];
                                if (exceeds(total, band.activity, tol))
                                        throw new ModelIntegrityException("Production in band " + band.id + " in " + in.years[t] + " is " + total + " exceeding activity " +
                                                band.activity);
                        }
                }
        }
}
