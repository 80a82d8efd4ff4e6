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
 * The parameter tables for one run, as supplied by the data loading collaborator.
 */
public class PlanningData
{
        public final List<Technology> technologies;
        public final List<CostRecord> costs;
        public final List<BaselineBand> bands;
        public final TargetSchedule targets;
        public final List<TechLink> links;

        public PlanningData(List<Technology> technologies, List<CostRecord> costs, List<BaselineBand> bands, TargetSchedule targets, List<TechLink> links)
        {
                this.technologies = copy(technologies);
                this.costs = copy(costs);
                this.bands = copy(bands);
                this.targets = targets;
                this.links = copy(links);
        }

        private static <T> List<T> copy(List<T> l)
        {
                if (l == null)
                        return Collections.emptyList();
                return Collections.unmodifiableList(new ArrayList<T>(l));
        }

        public double baseline_emissions()
        {
                double total = 0;
                for (BaselineBand b : bands)
                        total += b.emissions();
                return total;
        }
}
