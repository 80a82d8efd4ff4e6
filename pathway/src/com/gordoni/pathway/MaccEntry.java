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
 * One step of a marginal abatement cost curve.
 */
public class MaccEntry
{
        public final String tech_id;
        public final int year;
        public final double lcoa; // Levelized cost per unit abatement.
        public final double potential; // Abatement at full adoption.
        public final double cumulative; // Potential of this and all cheaper entries.

        public MaccEntry(String tech_id, int year, double lcoa, double potential, double cumulative)
        {
                this.tech_id = tech_id;
                this.year = year;
                this.lcoa = lcoa;
                this.potential = potential;
                this.cumulative = cumulative;
        }

        public String toString()
        {
                return tech_id + "@" + year + ": lcoa=" + lcoa + " potential=" + potential + " cumulative=" + cumulative;
        }
}
