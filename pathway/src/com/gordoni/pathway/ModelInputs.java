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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated input tables resolved to dense arrays over the model years.
 *
 * Arrays are indexed [technology][year index], technologies in input order and
 * years ascending. Nothing here changes after construction.
 *
 * Technology and cost series are resolved only from a technology's
 * commercial year on. Earlier years hold zero, so data need not cover years
 * in which nothing can be installed or produced.
 */
public class ModelInputs
{
        public final Config config;
        public final int[] years;
        public final int base_year;
        public final LifetimeWindow window;

        public final List<Technology> techs;
        public final List<BaselineBand> bands;
        public final List<TechLink> links;

        public final int[] band_of; // Technology to index into bands.
        public final double[] activity; // Technology to activity of its band.
        public final int[] lifetime;
        public final int[] commercial_year;
        public final double[] ramp; // Maximum annual installation in activity units.

        public final double[][] cap;
        public final double[][] abatement_factor;
        public final double[][] capex;
        public final double[][] fixed_opex;
        public final double[][] variable_opex;
        public final double[][] fuel_premium;

        public final double baseline; // Total baseline emissions.
        public final double[] target; // Emission ceiling by year.
        public final double[] required; // Required abatement by year.

        private final Map<String, Integer> tech_index = new HashMap<String, Integer>();
        private final Map<Integer, Integer> year_index = new HashMap<Integer, Integer>();

        public ModelInputs(Config config, PlanningData data)
        {
                this.config = config;
                config.validate();
                DataValidator.validate(data);

                Extrapolation extrapolation = Extrapolation.parse(config.extrapolation);
                years = config.model_years();
                base_year = config.discount_base_year();
                window = LifetimeWindow.parse(config.lifetime_window);
                for (int t = 0; t < years.length; t++)
                        year_index.put(years[t], t);

                techs = data.technologies;
                bands = data.bands;
                links = data.links;

                Map<String, Integer> band_index = new HashMap<String, Integer>();
                for (int b = 0; b < bands.size(); b++)
                        band_index.put(bands.get(b).id, b);
                Map<String, CostRecord> costs = new HashMap<String, CostRecord>();
                for (CostRecord c : data.costs)
                        costs.put(c.tech_id, c);

                int n = techs.size();
                band_of = new int[n];
                activity = new double[n];
                lifetime = new int[n];
                commercial_year = new int[n];
                ramp = new double[n];
                cap = new double[n][];
                abatement_factor = new double[n][];
                capex = new double[n][];
                fixed_opex = new double[n][];
                variable_opex = new double[n][];
                fuel_premium = new double[n][];

                List<String> errors = new ArrayList<String>();
                for (int i = 0; i < n; i++)
                {
                        Technology tech = techs.get(i);
                        CostRecord cost = costs.get(tech.id);
                        tech_index.put(tech.id, i);
                        band_of[i] = band_index.get(tech.band);
                        activity[i] = bands.get(band_of[i]).activity;
                        lifetime[i] = tech.lifetime;
                        commercial_year[i] = tech.commercial_year;
                        ramp[i] = (tech.ramp_rate == null ? config.ramp_default : tech.ramp_rate) * activity[i];

                        int from = commercial_year[i];
                        cap[i] = resolve_from(tech.id + " adoption_cap", tech.adoption_cap, from, extrapolation);
                        abatement_factor[i] = resolve_from(tech.id + " abatement_factor", tech.abatement_factor, from, extrapolation);
                        capex[i] = resolve_from(tech.id + " capex", cost.capex, from, extrapolation);
                        fixed_opex[i] = resolve_from(tech.id + " fixed_opex", cost.fixed_opex, from, extrapolation);
                        variable_opex[i] = resolve_from(tech.id + " variable_opex", cost.variable_opex, from, extrapolation);
                        if (cost.fuel_premium.isEmpty())
                                fuel_premium[i] = new double[years.length];
                        else
                                fuel_premium[i] = resolve_from(tech.id + " fuel_premium", cost.fuel_premium, from, extrapolation);

                        // Extrapolation may carry values past their valid range. Interpolation only rounds.
                        double intensity = bands.get(band_of[i]).emission_intensity;
                        double slop = 1e-12 * Math.max(1, intensity);
                        for (int t = 0; t < years.length; t++)
                        {
                                if (!(0 <= cap[i][t] && cap[i][t] <= 1 + 1e-12))
                                        errors.add("Technology " + tech.id + ": resolved adoption_cap " + cap[i][t] + " in " + years[t] + " is outside [0, 1]");
                                if (!(0 <= abatement_factor[i][t] && abatement_factor[i][t] <= intensity + slop))
                                        errors.add("Technology " + tech.id + ": resolved abatement_factor " + abatement_factor[i][t] + " in " + years[t] + " is outside [0, " + intensity + "]");
                                if (capex[i][t] < 0)
                                        errors.add("CostRecord " + tech.id + ": resolved capex " + capex[i][t] + " in " + years[t] + " is negative");
                        }
                }
                if (!errors.isEmpty())
                        throw new DataValidationException(errors);

                baseline = data.baseline_emissions();
                target = data.targets.resolve(years, extrapolation);
                required = TargetSchedule.required_abatement(baseline, target);
        }

        /**
         * Series values for the model years from the given year on, zero before.
         */
        private double[] resolve_from(String what, Map<Integer, Double> known, int from, Extrapolation extrapolation)
        {
                TimeSeries series = new TimeSeries(what, known, extrapolation);
                double[] res = new double[years.length];
                for (int t = 0; t < years.length; t++)
                        if (years[t] >= from)
                                res[t] = series.value(years[t]);
                return res;
        }

        public int num_techs()
        {
                return techs.size();
        }

        public int num_years()
        {
                return years.length;
        }

        public int tech_index(String id)
        {
                Integer i = tech_index.get(id);
                if (i == null)
                        throw new IllegalArgumentException("Unknown technology " + id);
                return i;
        }

        /**
         * Index of a model year, or -1 if the year is not modeled.
         */
        public int year_index(int year)
        {
                Integer t = year_index.get(year);
                return t == null ? -1 : t;
        }

        public double operating_cost(int i, int t)
        {
                return fixed_opex[i][t] + variable_opex[i][t] + fuel_premium[i][t];
        }

        /**
         * Technologies substituting into band b.
         */
        public List<Integer> techs_in_band(int b)
        {
                List<Integer> res = new ArrayList<Integer>();
                for (int i = 0; i < techs.size(); i++)
                        if (band_of[i] == b)
                                res.add(i);
                return Collections.unmodifiableList(res);
        }
}
