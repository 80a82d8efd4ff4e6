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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema, range and cross reference checks on the raw input tables.
 *
 * All problems found are reported together in one {@link DataValidationException}.
 * Anomalies that are valid input, such as adoption caps that fall over time,
 * are left alone.
 */
public class DataValidator
{
        private final List<String> errors = new ArrayList<String>();

        private void error(String msg)
        {
                errors.add(msg);
        }

        public static void validate(PlanningData data)
        {
                DataValidator v = new DataValidator();
                v.check(data);
                if (!v.errors.isEmpty())
                        throw new DataValidationException(v.errors);
        }

        private void check(PlanningData data)
        {
                Map<String, BaselineBand> bands = new HashMap<String, BaselineBand>();
                for (BaselineBand b : data.bands)
                {
                        if (b.id == null || b.id.equals(""))
                        {
                                error("BaselineBand: missing id");
                                continue;
                        }
                        if (bands.put(b.id, b) != null)
                                error("BaselineBand " + b.id + ": duplicate id");
                        if (!(b.activity > 0) || Double.isInfinite(b.activity))
                                error("BaselineBand " + b.id + ": activity must be positive and finite, got " + b.activity);
                        if (!(b.emission_intensity >= 0) || Double.isInfinite(b.emission_intensity))
                                error("BaselineBand " + b.id + ": emission_intensity must be non-negative and finite, got " + b.emission_intensity);
                }
                if (data.bands.isEmpty())
                        error("BaselineBand: no bands");

                Set<String> techs = new HashSet<String>();
                for (Technology t : data.technologies)
                {
                        if (t.id == null || t.id.equals(""))
                        {
                                error("Technology: missing id");
                                continue;
                        }
                        String where = "Technology " + t.id;
                        if (!techs.add(t.id))
                                error(where + ": duplicate id");
                        BaselineBand band = bands.get(t.band);
                        if (t.band == null)
                                error(where + ": missing band");
                        else if (band == null)
                                error(where + ": unknown band " + t.band);
                        if (t.lifetime == null)
                                error(where + ": missing lifetime");
                        else if (t.lifetime < 1)
                                error(where + ": lifetime must be at least 1, got " + t.lifetime);
                        if (t.commercial_year == null)
                                error(where + ": missing commercial_year");
                        if (t.ramp_rate != null && (!(t.ramp_rate >= 0) || Double.isInfinite(t.ramp_rate)))
                                error(where + ": ramp_rate must be non-negative and finite, got " + t.ramp_rate);
                        if (t.adoption_cap.isEmpty())
                                error(where + ": missing adoption_cap");
                        for (Map.Entry<Integer, Double> e : t.adoption_cap.entrySet())
                                if (e.getValue() == null || !(0 <= e.getValue() && e.getValue() <= 1))
                                        error(where + ": adoption_cap " + e.getValue() + " in " + e.getKey() + " is outside [0, 1]");
                        if (t.abatement_factor.isEmpty())
                                error(where + ": missing abatement_factor");
                        for (Map.Entry<Integer, Double> e : t.abatement_factor.entrySet())
                        {
                                Double f = e.getValue();
                                if (f == null || !(f >= 0) || Double.isInfinite(f))
                                        error(where + ": abatement_factor " + f + " in " + e.getKey() + " must be non-negative and finite");
                                else if (band != null && f > band.emission_intensity)
                                        error(where + ": abatement_factor " + f + " in " + e.getKey() + " exceeds the emission intensity of band " + band.id);
                        }
                }

                Set<String> costed = new HashSet<String>();
                for (CostRecord c : data.costs)
                {
                        String where = "CostRecord " + c.tech_id;
                        if (!techs.contains(c.tech_id))
                                error(where + ": unknown technology");
                        if (!costed.add(c.tech_id))
                                error(where + ": duplicate record");
                        if (c.capex.isEmpty())
                                error(where + ": missing capex");
                        check_values(where + ": capex", c.capex, true);
                        if (c.fixed_opex.isEmpty())
                                error(where + ": missing fixed_opex");
                        check_values(where + ": fixed_opex", c.fixed_opex, false);
                        if (c.variable_opex.isEmpty())
                                error(where + ": missing variable_opex");
                        check_values(where + ": variable_opex", c.variable_opex, false);
                        check_values(where + ": fuel_premium", c.fuel_premium, false);
                }
                for (String id : techs)
                        if (!costed.contains(id))
                                error("Technology " + id + ": missing cost record");

                if (data.targets == null || data.targets.ceiling.isEmpty())
                        error("EmissionsTarget: no targets");
                else
                        for (Map.Entry<Integer, Double> e : data.targets.ceiling.entrySet())
                                if (e.getValue() == null || !(e.getValue() >= 0) || Double.isInfinite(e.getValue()))
                                        error("EmissionsTarget " + e.getKey() + ": ceiling must be non-negative and finite, got " + e.getValue());

                for (TechLink l : data.links)
                {
                        if (l.rule == null)
                        {
                                error("TechLink " + l.tech_ids + ": missing rule");
                                continue;
                        }
                        for (String id : l.tech_ids)
                                if (!techs.contains(id))
                                        error("TechLink " + l + ": unknown technology " + id);
                        if (new HashSet<String>(l.tech_ids).size() != l.tech_ids.size())
                                error("TechLink " + l + ": repeated technology");
                        if (l.rule == TechLink.Rule.MUTUALLY_EXCLUSIVE && l.tech_ids.size() < 2)
                                error("TechLink " + l + ": exclusivity group needs at least two technologies");
                        if (l.rule == TechLink.Rule.COUPLING && l.tech_ids.size() != 2)
                                error("TechLink " + l + ": coupling needs exactly a primary and a secondary technology");
                }
        }

        private void check_values(String where, Map<Integer, Double> values, boolean non_negative)
        {
                for (Map.Entry<Integer, Double> e : values.entrySet())
                {
                        Double v = e.getValue();
                        if (v == null || Double.isNaN(v) || Double.isInfinite(v))
                                error(where + " in " + e.getKey() + " must be finite, got " + v);
                        else if (non_negative && v < 0)
                                error(where + " in " + e.getKey() + " must be non-negative, got " + v);
                }
        }
}
