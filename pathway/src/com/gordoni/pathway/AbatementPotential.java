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
import java.util.Comparator;
import java.util.List;

/**
 * Upper bound on the abatement that can be deployed in each model year.
 *
 * Each technology can hold at most the smaller of its adoption cap and its
 * ramp rate times the number of in service vintages installed on or after
 * commercialization. Within a band technologies are then filled greedily by
 * abatement factor until the band's activity is used up. Links are ignored,
 * so the bound never understates what the model can achieve.
 */
public class AbatementPotential
{
        private final ModelInputs in;
        private final double[] bound;

        public AbatementPotential(ModelInputs in, VintageIndex vintages)
        {
                this.in = in;
                this.bound = new double[in.num_years()];

                for (int t = 0; t < in.num_years(); t++)
                        for (int b = 0; b < in.bands.size(); b++)
                                bound[t] += band_bound(vintages, b, t);
        }

        public AbatementPotential(ModelInputs in)
        {
                this(in, new VintageIndex(in));
        }

        /**
         * Most capacity technology i can have in service in model year t.
         */
        public double max_capacity(VintageIndex vintages, int i, int t)
        {
                int vintage_count = 0;
                for (int tau : vintages.alive(i, t))
                        if (in.years[tau] >= in.commercial_year[i])
                                vintage_count++;
                return Math.min(in.cap[i][t] * in.activity[i], in.ramp[i] * vintage_count);
        }

        private double band_bound(VintageIndex vintages, int b, final int t)
        {
                List<Integer> techs = new ArrayList<Integer>(in.techs_in_band(b));
                Collections.sort(techs, new Comparator<Integer>()
                {
                        public int compare(Integer a, Integer c)
                        {
                                return Double.compare(in.abatement_factor[c][t], in.abatement_factor[a][t]);
                        }
                });

                double remaining = in.bands.get(b).activity;
                double abated = 0;
                for (int i : techs)
                {
                        if (remaining <= 0)
                                break;
                        double prod = Math.min(remaining, max_capacity(vintages, i, t));
                        abated += prod * in.abatement_factor[i][t];
                        remaining -= prod;
                }
                return abated;
        }

        public double bound(int t)
        {
                return bound[t];
        }

        /**
         * Model years in which the required abatement exceeds the bound.
         */
        public List<Integer> short_years()
        {
                double tol = in.config.tolerance;
                List<Integer> res = new ArrayList<Integer>();
                for (int t = 0; t < in.num_years(); t++)
                        if (in.required[t] - bound[t] > tol * Math.max(1, in.required[t]))
                                res.add(in.years[t]);
                return res;
        }
}
