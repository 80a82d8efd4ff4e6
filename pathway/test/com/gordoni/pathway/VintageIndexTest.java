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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class VintageIndexTest
{
        @Test
        void exclusiveWindowRetiresAtLifetime()
        {
                int[] years = { 2025, 2026, 2027, 2028 };
                VintageIndex v = new VintageIndex(years, new int[] { 2 }, LifetimeWindow.EXCLUSIVE);

                assertArrayEquals(new int[] { 0 }, v.alive(0, 0));
                assertArrayEquals(new int[] { 0, 1 }, v.alive(0, 1));
                assertArrayEquals(new int[] { 1, 2 }, v.alive(0, 2));
                assertArrayEquals(new int[] { 0, 1 }, v.serves(0, 0));
                assertArrayEquals(new int[] { 3 }, v.serves(0, 3));
        }

        @Test
        void inclusiveWindowKeepsOneMoreYear()
        {
                int[] years = { 2025, 2026, 2027, 2028 };
                VintageIndex v = new VintageIndex(years, new int[] { 2 }, LifetimeWindow.INCLUSIVE);

                assertArrayEquals(new int[] { 0, 1, 2 }, v.alive(0, 2));
                assertArrayEquals(new int[] { 1, 2, 3 }, v.alive(0, 3));
        }

        @Test
        void sparseYearsUseCalendarAges()
        {
                int[] years = { 2025, 2030, 2040 };
                VintageIndex v = new VintageIndex(years, new int[] { 10 }, LifetimeWindow.EXCLUSIVE);

                assertArrayEquals(new int[] { 0, 1 }, v.alive(0, 1));
                assertArrayEquals(new int[] { 2 }, v.alive(0, 2));
        }

        @ParameterizedTest
        @EnumSource(LifetimeWindow.class)
        void matchesDirectCountOverRandomInstallations(LifetimeWindow window)
        {
                Random random = new Random(42);
                for (int trial = 0; trial < 200; trial++)
                {
                        int n = 1 + random.nextInt(30);
                        int[] years = new int[n];
                        int year = 2020;
                        for (int t = 0; t < n; t++)
                        {
                                year += 1 + random.nextInt(3);
                                years[t] = year;
                        }
                        int lifetime = 1 + random.nextInt(15);
                        double[] installs = new double[n];
                        for (int t = 0; t < n; t++)
                                installs[t] = random.nextBoolean() ? 0 : random.nextDouble() * 10;

                        VintageIndex v = new VintageIndex(years, new int[] { lifetime }, window);
                        double[] fast = v.in_service(0, installs);
                        double[] direct = VintageIndex.in_service(years, installs, lifetime, window);
                        assertArrayEquals(direct, fast, 1e-9);

                        for (int t = 0; t < n; t++)
                        {
                                double expected = 0;
                                for (int tau = 0; tau <= t; tau++)
                                {
                                        int age = years[t] - years[tau];
                                        if (window == LifetimeWindow.EXCLUSIVE ? age < lifetime : age <= lifetime)
                                                expected += installs[tau];
                                }
                                assertEquals(expected, fast[t], 1e-9);
                        }
                }
        }
}
