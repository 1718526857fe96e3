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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.mrrtoolbox.instruments.json.DateTimeSerde;
import org.joda.time.DateTime;

public class TemperatureReading {
  @JsonProperty("slave_address")
  private Integer slaveAddress;

  @JsonProperty("process_value")
  private Double processValue;

  @JsonProperty("set_point")
  private Double setPoint;

  @JsonProperty("timestamp")
  @JsonSerialize(using = DateTimeSerde.DateTimeSerializer.class)
  @JsonDeserialize(using = DateTimeSerde.DateTimeDeserializer.class)
  private DateTime timeOfReading;

  private TemperatureReading() {}

  public TemperatureReading(Integer slaveAddress, Double processValue, Double setPoint, DateTime timeOfReading) {
    this.slaveAddress = slaveAddress;
    this.processValue = processValue;
    this.setPoint = setPoint;
    this.timeOfReading = timeOfReading;
  }

  public Integer getSlaveAddress() {
    return slaveAddress;
  }

  public Double getProcessValue() {
    return processValue;
  }

  public Double getSetPoint() {
    return setPoint;
  }

  public DateTime getTimeOfReading() {
    return timeOfReading;
  }

  /**
   * True when the nozzle is no more than {@code tolerance} degrees below its set point.
   */
  public boolean withinTolerance(Double tolerance) {
    return processValue >= setPoint - tolerance;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    TemperatureReading that = (TemperatureReading) o;

    if (slaveAddress != null ? !slaveAddress.equals(that.slaveAddress) : that.slaveAddress != null) return false;
    if (processValue != null ? !processValue.equals(that.processValue) : that.processValue != null) return false;
    if (setPoint != null ? !setPoint.equals(that.setPoint) : that.setPoint != null) return false;
    return timeOfReading != null ? timeOfReading.isEqual(that.timeOfReading) : that.timeOfReading == null;
  }

  @Override
  public int hashCode() {
    int result = slaveAddress != null ? slaveAddress.hashCode() : 0;
    result = 31 * result + (processValue != null ? processValue.hashCode() : 0);
    result = 31 * result + (setPoint != null ? setPoint.hashCode() : 0);
    result = 31 * result + (timeOfReading != null ? Long.hashCode(timeOfReading.getMillis()) : 0);
    return result;
  }
}
