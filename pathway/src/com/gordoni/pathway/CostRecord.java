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

/**
 * Cost data for one technology as sparse year to value tables.
 */
public class CostRecord
{
        public final String tech_id;
        public final Map<Integer, Double> capex; // Capital cost per unit of new capacity.
        public final Map<Integer, Double> fixed_opex; // Fixed operating cost per unit production.
        public final Map<Integer, Double> variable_opex; // Variable operating cost per unit production.
        public final Map<Integer, Double> fuel_premium; // Optional fuel cost premium per unit production. Empty for none.

        public CostRecord(String tech_id, Map<Integer, Double> capex, Map<Integer, Double> fixed_opex, Map<Integer, Double> variable_opex, Map<Integer, Double> fuel_premium)
        {
                this.tech_id = tech_id;
                this.capex = Technology.freeze(capex);
                this.fixed_opex = Technology.freeze(fixed_opex);
                this.variable_opex = Technology.freeze(variable_opex);
                this.fuel_premium = Technology.freeze(fuel_premium);
        }

        /**
         * Costs that do not vary by year.
         *
         * Keyed at year 0, so only usable with flat or linear extrapolation.
         */
        public CostRecord(String tech_id, double capex, double fixed_opex, double variable_opex)
        {
                this(tech_id, Collections.singletonMap(0, capex), Collections.singletonMap(0, fixed_opex), Collections.singletonMap(0, variable_opex), null);
        }
}
