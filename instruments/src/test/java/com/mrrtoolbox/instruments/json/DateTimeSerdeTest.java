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

package com.mrrtoolbox.instruments.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DateTimeSerdeTest {
  static class Stamped {
    @JsonProperty("at")
    @JsonSerialize(using = DateTimeSerde.DateTimeSerializer.class)
    @JsonDeserialize(using = DateTimeSerde.DateTimeDeserializer.class)
    DateTime at;
  }

  @Test
  public void testWritesUtc() throws Exception {
    Stamped s = new Stamped();
    s.at = new DateTime(2024, 3, 5, 16, 30, 0, 0, DateTimeZone.forOffsetHours(2));
    assertEquals("{\"at\":\"2024-03-05T14:30:00.000Z\"}", new ObjectMapper().writeValueAsString(s));
  }

  @Test
  public void testReadsOffsetTimestamps() throws Exception {
    Stamped s = new ObjectMapper().readValue("{\"at\":\"2024-03-05T16:30:00.000+02:00\"}", Stamped.class);
    assertTrue(new DateTime(2024, 3, 5, 14, 30, 0, 0, DateTimeZone.UTC).isEqual(s.at));
    assertEquals(DateTimeZone.UTC, s.at.getZone());
  }

  @Test
  public void testReadsEpochMillis() throws Exception {
    Stamped s = new ObjectMapper().readValue("{\"at\":1709649000000}", Stamped.class);
    assertEquals(new DateTime(2024, 3, 5, 14, 30, 0, 0, DateTimeZone.UTC), s.at);
  }

  @Test(expected = JsonMappingException.class)
  public void testRejectsEmptyTimestamp() throws Exception {
    new ObjectMapper().readValue("{\"at\":\"  \"}", Stamped.class);
  }
}
