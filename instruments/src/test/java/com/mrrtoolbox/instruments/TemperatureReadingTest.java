/*************************************************************************
*                                                                        *
*  This file is part of the mrr-toolbox project.                         *
*  mrr-toolbox drives and analyzes broadband rotational spectroscopy.    *
*  Copyright (C) 2024 The mrr-toolbox Authors.                           *
*                                                                        *
*  Please direct all queries to the mrr-toolbox issue tracker.           *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.mrrtoolbox.instruments;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TemperatureReadingTest {
  private static final DateTime TIME = new DateTime(2024, 3, 5, 14, 30, 0, 250, DateTimeZone.UTC);

  @Test
  public void testWithinTolerance() {
    TemperatureReading reading = new TemperatureReading(3, 95.0, 100.0, TIME);
    assertTrue(reading.withinTolerance(5.0));
    assertFalse(reading.withinTolerance(4.9));
    assertTrue("Overshoot is within any tolerance", new TemperatureReading(3, 105.0, 100.0, TIME)
        .withinTolerance(0.0));
  }

  @Test
  public void testJsonUsesIsoTimestamps() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    TemperatureReading reading = new TemperatureReading(4, 99.9, 100.0, TIME);

    String json = mapper.writeValueAsString(reading);
    JsonNode node = mapper.readTree(json);
    assertEquals("2024-03-05T14:30:00.250Z", node.get("timestamp").asText());
    assertEquals(4, node.get("slave_address").asInt());

    assertEquals(reading, mapper.readValue(json, TemperatureReading.class));
  }
}
