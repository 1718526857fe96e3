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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

import java.io.IOException;

/**
 * Reading timestamps as ISO-8601 strings normalized to UTC. Older monitor logs stored epoch
 * milliseconds, which are still accepted on input.
 */
public class DateTimeSerde {
  private static final DateTimeFormatter READING_TIME_FORMAT = ISODateTimeFormat.dateTime().withZoneUTC();

  public static class DateTimeSerializer extends JsonSerializer<DateTime> {
    @Override
    public void serialize(DateTime timestamp, JsonGenerator gen, SerializerProvider serializers) throws IOException {
      gen.writeString(READING_TIME_FORMAT.print(timestamp));
    }
  }

  public static class DateTimeDeserializer extends JsonDeserializer<DateTime> {
    @Override
    public DateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) {
        return new DateTime(p.getLongValue(), DateTimeZone.UTC);
      }
      String text = p.getText().trim();
      if (text.isEmpty()) {
        return (DateTime) ctxt.handleWeirdStringValue(DateTime.class, text, "Empty reading timestamp");
      }
      return READING_TIME_FORMAT.parseDateTime(text);
    }
  }
}
