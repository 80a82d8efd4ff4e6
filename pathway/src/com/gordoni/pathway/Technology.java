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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * An abatement technology that substitutes into one baseline band.
 *
 * Adoption cap and abatement factor are sparse year to value tables resolved
 * to the model years at build time. A null ramp rate means the configured
 * default applies. Lifetime and commercial year are boxed so that missing
 * values reach validation rather than defaulting silently.
 */
public class Technology
{
        public final String id;
        public final String band; // Id of the baseline band whose activity this technology takes over.
        public final Integer lifetime; // Operating life in years.
        public final Integer commercial_year; // Earliest year in which capacity may be installed.
        public final Double ramp_rate; // Maximum annual installation as a fraction of band activity. Null for the configured default.
        public final Map<Integer, Double> adoption_cap; // Year to maximum share of band activity.
        public final Map<Integer, Double> abatement_factor; // Year to emission reduction per unit production.

        public Technology(String id, String band, Integer lifetime, Integer commercial_year, Double ramp_rate, Map<Integer, Double> adoption_cap, Map<Integer, Double> abatement_factor)
        {
                this.id = id;
                this.band = band;
                this.lifetime = lifetime;
                this.commercial_year = commercial_year;
                this.ramp_rate = ramp_rate;
                this.adoption_cap = freeze(adoption_cap);
                this.abatement_factor = freeze(abatement_factor);
        }

        /**
         * Technology with a cap and abatement factor that do not vary by year.
         *
         * The values are keyed at the commercial year, so they hold for every
         * model year only under flat or linear extrapolation. With extrapolation
         * "none" supply tables covering the model years from the commercial year on.
         */
        public Technology(String id, String band, Integer lifetime, Integer commercial_year, Double ramp_rate, double adoption_cap, double abatement_factor)
        {
                this(id, band, lifetime, commercial_year, ramp_rate, Collections.singletonMap(commercial_year == null ? 0 : commercial_year, adoption_cap),
                        Collections.singletonMap(commercial_year == null ? 0 : commercial_year, abatement_factor));
        }

        static Map<Integer, Double> freeze(Map<Integer, Double> m)
        {
                if (m == null)
                        return Collections.emptyMap();
                return Collections.unmodifiableMap(new TreeMap<Integer, Double>(m));
        }

        public String toString()
        {
                return "Technology(" + id + ", " + band + ", life=" + lifetime + ", from=" + commercial_year + ")";
        }
}
