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
 * Marginal abatement cost curve.
 *
 * For a model year, the technologies commercially available that year are
 * ranked by levelized cost of abatement,
 *
 *     lcoa = (CRF * capex + operating cost) / abatement factor
 *
 * with potential equal to the abatement at the adoption cap. Technologies
 * that do not abate that year are left off the curve.
 */
public class MaccCurve
{
        private static final Comparator<MaccEntry> LcoaComparator = new Comparator<MaccEntry>()
        {
                public int compare(MaccEntry a, MaccEntry b)
                {
                        int c = Double.compare(a.lcoa, b.lcoa);
                        return c != 0 ? c : a.tech_id.compareTo(b.tech_id);
                }
        };

        private final ModelInputs in;

        public MaccCurve(ModelInputs in)
        {
                this.in = in;
        }

        public List<MaccEntry> entries(int year)
        {
                int t = in.year_index(year);
                if (t < 0)
                        throw new IllegalArgumentException("Not a model year: " + year);

                List<MaccEntry> unsorted = new ArrayList<MaccEntry>();
                for (int i = 0; i < in.num_techs(); i++)
                {
                        double factor = in.abatement_factor[i][t];
                        if (year < in.commercial_year[i] || factor <= 0)
                                continue;
                        double crf = ObjectiveBuilder.capital_recovery_factor(in.config.discount_rate, in.lifetime[i]);
                        double lcoa = (crf * in.capex[i][t] + in.operating_cost(i, t)) / factor;
                        double potential = in.cap[i][t] * in.activity[i] * factor;
                        unsorted.add(new MaccEntry(in.techs.get(i).id, year, lcoa, potential, 0));
                }
                Collections.sort(unsorted, LcoaComparator);

                List<MaccEntry> res = new ArrayList<MaccEntry>();
                double cumulative = 0;
                for (MaccEntry e : unsorted)
                {
                        cumulative += e.potential;
                        res.add(new MaccEntry(e.tech_id, e.year, e.lcoa, e.potential, cumulative));
                }
                return res;
        }

        /**
         * Cheapest levelized cost at which the given abatement can be reached, or NaN if the curve never reaches it.
         */
        public double marginal_cost(int year, double abatement)
        {
                for (MaccEntry e : entries(year))
                        if (e.cumulative >= abatement)
                                return e.lcoa;
                return Double.NaN;
        }
}
