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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All nozzle temperature controllers sharing one bus, addressed together.
 */
public class TemperatureControllers implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(TemperatureControllers.class);

  private final SerialLink link;
  private final List<ModbusTemperatureController> controllers;

  public TemperatureControllers(SerialLink link, List<Integer> slaveAddresses) {
    this.link = link;
    List<ModbusTemperatureController> cs = new ArrayList<>(slaveAddresses.size());
    for (Integer address : slaveAddresses) {
      cs.add(new ModbusTemperatureController(link, address));
    }
    this.controllers = Collections.unmodifiableList(cs);
  }

  public static TemperatureControllers connect(InstrumentConfig.TemperatureSettings settings) throws IOException {
    return new TemperatureControllers(new TcpSerialLink(settings), settings.getSlaveAddresses());
  }

  public List<ModbusTemperatureController> getControllers() {
    return controllers;
  }

  public DateTime now() {
    return new DateTime(DateTimeZone.UTC);
  }

  /**
   * Process value and set point of every controller, in address order of construction.
   */
  public List<TemperatureReading> readAll() throws IOException {
    List<TemperatureReading> readings = new ArrayList<>(controllers.size());
    for (ModbusTemperatureController c : controllers) {
      Double pv = c.readProcessValue();
      Double sv = c.readSetPoint();
      readings.add(new TemperatureReading(c.getSlaveAddress(), pv, sv, now()));
      LOGGER.debug("Controller %d: PV %.1f C, SV %.1f C", c.getSlaveAddress(), pv, sv);
    }
    return readings;
  }

  public void setAllSetPoints(Double celsius) throws IOException {
    for (ModbusTemperatureController c : controllers) {
      c.writeSetPoint(celsius);
    }
  }

  /**
   * True when every nozzle is no more than {@code tolerance} degrees below its set point.  Stops reading at the first
   * nozzle that is not.
   */
  public boolean withinTolerance(Double tolerance) throws IOException {
    for (ModbusTemperatureController c : controllers) {
      Double sv = c.readSetPoint();
      Double pv = c.readProcessValue();
      if (pv < sv - tolerance) {
        LOGGER.info("Controller %d at %.1f C is more than %.1f C below its set point %.1f C",
            c.getSlaveAddress(), pv, tolerance, sv);
        return false;
      }
    }
    return true;
  }

  @Override
  public void close() throws IOException {
    link.close();
  }
}
