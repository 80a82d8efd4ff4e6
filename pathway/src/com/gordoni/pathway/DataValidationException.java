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
 * Input tables are malformed or missing required fields. Thrown before a model is built.
 */
public class DataValidationException extends IllegalArgumentException
{
        private static final long serialVersionUID = 1L;

        private final List<String> errors;

        public DataValidationException(List<String> errors)
        {
                super(summary(errors));
                this.errors = Collections.unmodifiableList(new ArrayList<String>(errors));
        }

        public DataValidationException(String error)
        {
                this(Collections.singletonList(error));
        }

        private static String summary(List<String> errors)
        {
                if (errors.size() == 1)
                        return errors.get(0);
                StringBuilder sb = new StringBuilder(errors.size() + " input errors: ");
                for (int i = 0; i < errors.size(); i++)
                        sb.append(i == 0 ? "" : "; ").append(errors.get(i));
                return sb.toString();
        }

        public List<String> errors()
        {
                return errors;
        }
}
