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
 * Deployment of one technology in one model year.
 */
public class TechYearResult
{
        public final String tech_id;
        public final int year;
        public final double installed; // New capacity installed this year.
        public final double in_service; // Capacity in service this year.
        public final double share; // In-service capacity as a fraction of band activity.
        public final double production;
        public final double abatement;
        public final double capital_charge; // Annualized capital cost attributed to this year.
        public final double operating_cost;
        public final double discount_factor;

        public TechYearResult(String tech_id, int year, double installed, double in_service, double share, double production, double abatement,
                double capital_charge, double operating_cost, double discount_factor)
        {
                this.tech_id = tech_id;
                this.year = year;
                this.installed = installed;
                this.in_service = in_service;
                this.share = share;
                this.production = production;
                this.abatement = abatement;
                this.capital_charge = capital_charge;
                this.operating_cost = operating_cost;
                this.discount_factor = discount_factor;
        }

        public double annual_cost()
        {
                return capital_charge + operating_cost;
        }

        public double discounted_cost()
        {
                return annual_cost() * discount_factor;
        }

        public String toString()
        {
                return tech_id + "@" + year + ": installed=" + installed + " in_service=" + in_service + " production=" + production + " abatement=" + abatement;
        }
}
