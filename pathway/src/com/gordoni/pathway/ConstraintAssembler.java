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

import java.util.List;

import com.gordoni.pathway.LinearProgram.Relation;
import com.gordoni.pathway.LinearProgram.Row;

/**
 * Adds the structural constraints of the deployment model to a linear program.
 *
 * Shares are expressed as in-service capacity divided by band activity, so
 * share constraints are linear in the capacity variables.
 */
public class ConstraintAssembler
{
        public static final String VINTAGE = "vintage";
        public static final String START_GATE = "start_gate";
        public static final String RAMP = "ramp";
        public static final String PRODUCTION_LIMIT = "production_limit";
        public static final String ADOPTION_CAP = "adoption_cap";
        public static final String MASS_BALANCE = "mass_balance";
        public static final String ABATEMENT = "abatement";
        public static final String TARGET = "target";
        public static final String EXCLUSIVITY = "exclusivity";
        public static final String COUPLING = "coupling";

        private final ModelInputs in;
        private final VintageIndex vintages;
        private final VariableLayout vars;
        private final LinearProgram lp;

        public ConstraintAssembler(ModelInputs in, VintageIndex vintages, VariableLayout vars, LinearProgram lp)
        {
                this.in = in;
                this.vintages = vintages;
                this.vars = vars;
                this.lp = lp;
        }

        public void assemble()
        {
                for (int i = 0; i < in.num_techs(); i++)
                        for (int t = 0; t < in.num_years(); t++)
                                technology_year(i, t);

                for (int b = 0; b < in.bands.size(); b++)
                        mass_balance(b);

                for (int t = 0; t < in.num_years(); t++)
                        target(t);

                for (TechLink link : in.links)
                        if (link.rule == TechLink.Rule.MUTUALLY_EXCLUSIVE)
                                exclusivity(link);
                        else
                                coupling(link);
        }

        private String at(int i, int t)
        {
                return "[" + in.techs.get(i).id + "," + in.years[t] + "]";
        }

        private void technology_year(int i, int t)
        {
                String at = at(i, t);

                Row vintage = lp.add_row(VINTAGE, VINTAGE + at, Relation.EQ, 0);
                vintage.add(vars.capacity(i, t), 1);
                for (int tau : vintages.alive(i, t))
                        vintage.add(vars.install(i, tau), -1);

                // Equality, not a zero upper bound.
                if (in.years[t] < in.commercial_year[i])
                        lp.add_row(START_GATE, START_GATE + at, Relation.EQ, 0).add(vars.install(i, t), 1);

                lp.add_row(RAMP, RAMP + at, Relation.LEQ, in.ramp[i]).add(vars.install(i, t), 1);

                lp.add_row(PRODUCTION_LIMIT, PRODUCTION_LIMIT + at, Relation.LEQ, 0)
                        .add(vars.production(i, t), 1)
                        .add(vars.capacity(i, t), -1);

                lp.add_row(ADOPTION_CAP, ADOPTION_CAP + at, Relation.LEQ, in.cap[i][t] * in.activity[i]).add(vars.capacity(i, t), 1);

                lp.add_row(ABATEMENT, ABATEMENT + at, Relation.EQ, 0)
                        .add(vars.abatement(i, t), 1)
                        .add(vars.production(i, t), -in.abatement_factor[i][t]);
        }

        private void mass_balance(int b)
        {
                List<Integer> techs = in.techs_in_band(b);
                if (techs.isEmpty())
                        return;
                BaselineBand band = in.bands.get(b);
                for (int t = 0; t < in.num_years(); t++)
                {
                        Row row = lp.add_row(MASS_BALANCE, MASS_BALANCE + "[" + band.id + "," + in.years[t] + "]", Relation.LEQ, band.activity);
                        for (int i : techs)
                                row.add(vars.production(i, t), 1);
                }
        }

        private void target(int t)
        {
                if (in.required[t] <= 0)
                        return;
                Row row = lp.add_row(TARGET, TARGET + "[" + in.years[t] + "]", Relation.GEQ, in.required[t]);
                for (int i = 0; i < in.num_techs(); i++)
                        row.add(vars.abatement(i, t), 1);
                if (vars.has_slack())
                        row.add(vars.shortfall(t), 1);
        }

        private void exclusivity(TechLink link)
        {
                for (int t = 0; t < in.num_years(); t++)
                {
                        Row row = lp.add_row(EXCLUSIVITY, EXCLUSIVITY + link.tech_ids + "[" + in.years[t] + "]", Relation.LEQ, 1);
                        for (String id : link.tech_ids)
                        {
                                int i = in.tech_index(id);
                                row.add(vars.capacity(i, t), 1 / in.activity[i]);
                        }
                }
        }

        private void coupling(TechLink link)
        {
                int p = in.tech_index(link.primary());
                int s = in.tech_index(link.secondary());
                for (int t = 0; t < in.num_years(); t++)
                        lp.add_row(COUPLING, COUPLING + link.tech_ids + "[" + in.years[t] + "]", Relation.GEQ, 0)
                                .add(vars.capacity(s, t), 1 / in.activity[s])
                                .add(vars.capacity(p, t), -1 / in.activity[p]);
        }
}
