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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A relationship between technologies that holds in every model year.
 */
public class TechLink
{
        public enum Rule
        {
                MUTUALLY_EXCLUSIVE, // Combined share of the technologies is at most 1.
                COUPLING // Share of the secondary (second id) is at least the share of the primary (first id).
        }

        public final Rule rule;
        public final List<String> tech_ids;

        public TechLink(Rule rule, List<String> tech_ids)
        {
                this.rule = rule;
                this.tech_ids = Collections.unmodifiableList(new ArrayList<String>(tech_ids));
        }

        public static TechLink exclusive(String... tech_ids)
        {
                return new TechLink(Rule.MUTUALLY_EXCLUSIVE, Arrays.asList(tech_ids));
        }

        public static TechLink coupling(String primary, String secondary)
        {
                return new TechLink(Rule.COUPLING, Arrays.asList(primary, secondary));
        }

        public String primary()
        {
                assert(rule == Rule.COUPLING);
                return tech_ids.get(0);
        }

        public String secondary()
        {
                assert(rule == Rule.COUPLING);
                return tech_ids.get(1);
        }

        public String toString()
        {
                return rule + tech_ids.toString();
        }
}
