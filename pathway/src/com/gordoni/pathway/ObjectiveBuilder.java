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
 * Discounted total system cost.
 *
 * cost = sum over years t of df(t) * ( sum over technologies of capital charge + operating cost * production
 *                                     + penalty * shortfall(t) )
 *
 * Capital is annualized with the capital recovery factor. Under the default
 * "install_year" capital charge an installation pays CRF * capex once, in the
 * installation year. Under "stream" it pays CRF * capex in every model year it
 * is in service, so installations late in the horizon are not charged for
 * years beyond it.
 */
public class ObjectiveBuilder
{
        private final ModelInputs in;
        private final VintageIndex vintages;
        private final VariableLayout vars;
        private final LinearProgram lp;

        private final double[] df;
        private final double[] crf;
        private double penalty = 0;
        private double penalty_floor = 0;

        public ObjectiveBuilder(ModelInputs in, VintageIndex vintages, VariableLayout vars, LinearProgram lp)
        {
                this.in = in;
                this.vintages = vintages;
                this.vars = vars;
                this.lp = lp;

                double rate = in.config.discount_rate;
                df = new double[in.num_years()];
                for (int t = 0; t < df.length; t++)
                        df[t] = discount_factor(rate, in.years[t], in.base_year);
                crf = new double[in.num_techs()];
                for (int i = 0; i < crf.length; i++)
                        crf[i] = capital_recovery_factor(rate, in.lifetime[i]);
        }

        /**
         * Equivalent annual payment per unit of capital over the given life.
         */
        public static double capital_recovery_factor(double rate, int life)
        {
                assert(life >= 1);
                if (rate == 0)
                        return 1.0 / life;
                return rate / (1 - Math.pow(1 + rate, - life));
        }

        public static double discount_factor(double rate, int year, int base_year)
        {
                return Math.pow(1 + rate, - (year - base_year));
        }

        public double discount_factor(int t)
        {
                return df[t];
        }

        public double crf(int i)
        {
                return crf[i];
        }

        /**
         * Objective coefficient of one unit of installation of technology i in year tau.
         */
        public double capital_coef(int i, int tau)
        {
                double annual = crf[i] * in.capex[i][tau];
                if (in.config.capital_charge.equals("install_year"))
                        return annual * df[tau];
                double c = 0;
                for (int t : vintages.serves(i, tau))
                        c += annual * df[t];
                return c;
        }

        public double production_coef(int i, int t)
        {
                return df[t] * in.operating_cost(i, t);
        }

        public void build()
        {
                for (int i = 0; i < in.num_techs(); i++)
                        for (int t = 0; t < in.num_years(); t++)
                        {
                                lp.add_objective(vars.install(i, t), capital_coef(i, t));
                                lp.add_objective(vars.production(i, t), production_coef(i, t));
                        }

                penalty_floor = costliest_abatement();
                if (in.config.slack_penalty != null)
                        penalty = in.config.slack_penalty;
                else
                        penalty = in.config.slack_penalty_factor * Math.max(penalty_floor, 1);
                if (in.config.trace && in.config.slack && penalty <= penalty_floor)
                        System.out.println("Warning: slack_penalty " + penalty + " does not exceed the costliest abatement " + penalty_floor);

                if (vars.has_slack())
                        for (int t = 0; t < in.num_years(); t++)
                                lp.add_objective(vars.shortfall(t), df[t] * penalty);
        }

        /**
         * Upper bound, in undiscounted cost per unit abatement, on what any technology charges to abate one unit in one year.
         *
         * The whole capital coefficient of the most expensive vintage is
         * attributed to a single year of abatement, so deploying any technology
         * costs less than a shortfall penalty above this bound.
         */
        public double costliest_abatement()
        {
                double worst = 0;
                for (int i = 0; i < in.num_techs(); i++)
                {
                        double capital = 0;
                        for (int tau = 0; tau < in.num_years(); tau++)
                                capital = Math.max(capital, capital_coef(i, tau));
                        for (int t = 0; t < in.num_years(); t++)
                        {
                                double factor = in.abatement_factor[i][t];
                                if (factor <= 0)
                                        continue;
                                double cost = (capital + Math.max(0, production_coef(i, t))) / (factor * df[t]);
                                worst = Math.max(worst, cost);
                        }
                }
                return worst;
        }

        /**
         * Shortfall penalty per unit, undiscounted. Zero until built.
         */
        public double penalty()
        {
                return penalty;
        }
}
