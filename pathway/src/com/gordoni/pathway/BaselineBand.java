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
 * A fixed process segment: annual activity and emission intensity held constant over the horizon.
 */
public class BaselineBand
{
        public final String id;
        public final double activity; // Annual activity, shared ceiling for all technologies targeting this band.
        public final double emission_intensity; // Emissions per unit activity.

        public BaselineBand(String id, double activity, double emission_intensity)
        {
                this.id = id;
                this.activity = activity;
                this.emission_intensity = emission_intensity;
        }

        public double emissions()
        {
                return activity * emission_intensity;
        }
}
