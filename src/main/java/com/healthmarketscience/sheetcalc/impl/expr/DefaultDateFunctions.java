/*
Copyright (c) 2024 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.sheetcalc.impl.expr;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Period;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * Date and time functions.  Dates are serial numbers: whole days since
 * 1899-12-30, with the time of day as the fractional part.
 *
 * @author James Ahlborn
 */
public class DefaultDateFunctions
{
  /** day zero of the serial date numbering */
  static final LocalDate BASE_LD = LocalDate.of(1899, 12, 30);

  private static final long SECONDS_PER_DAY = (24L * 60L * 60L);

  private static final DateTimeFormatter US_DATE_FMT =
    DateTimeFormatter.ofPattern("M/d/uuuu", Locale.US);
  private static final DateTimeFormatter US_DATE_TIME_FMT =
    DateTimeFormatter.ofPattern("M/d/uuuu H:mm[:ss]", Locale.US);

  private DefaultDateFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function TODAY = registerFunc(new Func0("TODAY") {
    @Override
    public boolean isVolatile() {
      return true;
    }
    @Override
    protected Value eval0(EvalContext ctx) {
      return ValueSupport.toValue(toSerial(LocalDate.now(ctx.getClock())));
    }
  });

  public static final Function NOW = registerFunc(new Func0("NOW") {
    @Override
    public boolean isVolatile() {
      return true;
    }
    @Override
    protected Value eval0(EvalContext ctx) {
      return ValueSupport.toValue(toSerial(LocalDateTime.now(ctx.getClock())));
    }
  });

  public static final Function DATE = registerFunc(new Func3("DATE") {
    @Override
    protected Value eval3(EvalContext ctx, Value param1, Value param2,
                          Value param3) {
      int year = toScalar(param1).getAsInt();
      int month = toScalar(param2).getAsInt();
      int day = toScalar(param3).getAsInt();
      if(year < 0) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      if(year < 1900) {
        // two digit (and other small) years are offsets from 1900
        year += 1900;
      }
      // month and day overflow into the following (or previous) periods
      LocalDate ld = LocalDate.of(year, 1, 1)
        .plusMonths(month - 1L).plusDays(day - 1L);
      return ValueSupport.toValue(toSerial(ld));
    }
  });

  public static final Function YEAR = registerFunc(new Func1("YEAR") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(toLocalDate(param1).getYear());
    }
  });

  public static final Function MONTH = registerFunc(new Func1("MONTH") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(toLocalDate(param1).getMonthValue());
    }
  });

  public static final Function DAY = registerFunc(new Func1("DAY") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(toLocalDate(param1).getDayOfMonth());
    }
  });

  public static final Function HOUR = registerFunc(new Func1("HOUR") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(toLocalTime(param1).getHour());
    }
  });

  public static final Function MINUTE = registerFunc(new Func1("MINUTE") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(toLocalTime(param1).getMinute());
    }
  });

  public static final Function SECOND = registerFunc(new Func1("SECOND") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(toLocalTime(param1).getSecond());
    }
  });

  public static final Function DATEDIF = registerFunc(new Func3("DATEDIF") {
    @Override
    protected Value eval3(EvalContext ctx, Value param1, Value param2,
                          Value param3) {
      LocalDate start = toLocalDate(param1);
      LocalDate end = toLocalDate(param2);
      String unit = toScalar(param3).getAsString().trim()
        .toUpperCase(Locale.ROOT);
      if(start.isAfter(end)) {
        return ValueSupport.toError(FormulaError.NUM);
      }

      switch(unit) {
      case "Y":
        return ValueSupport.toValue(ChronoUnit.YEARS.between(start, end));
      case "M":
        return ValueSupport.toValue(ChronoUnit.MONTHS.between(start, end));
      case "D":
        return ValueSupport.toValue(ChronoUnit.DAYS.between(start, end));
      case "MD":
        return ValueSupport.toValue(Period.between(start, end).getDays());
      case "YM":
        return ValueSupport.toValue(Period.between(start, end).getMonths());
      case "YD":
        LocalDate shifted = start.withYear(end.getYear());
        if(shifted.isAfter(end)) {
          shifted = shifted.minusYears(1);
        }
        return ValueSupport.toValue(ChronoUnit.DAYS.between(shifted, end));
      default:
        return ValueSupport.toError(FormulaError.NUM);
      }
    }
  });

  public static final Function EDATE = registerFunc(new Func2("EDATE") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      LocalDate ld = toLocalDate(param1)
        .plusMonths(toScalar(param2).getAsInt());
      return ValueSupport.toValue(toSerial(ld));
    }
  });

  public static final Function EOMONTH = registerFunc(new Func2("EOMONTH") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      LocalDate ld = toLocalDate(param1)
        .plusMonths(toScalar(param2).getAsInt())
        .with(TemporalAdjusters.lastDayOfMonth());
      return ValueSupport.toValue(toSerial(ld));
    }
  });

  public static final Function WEEKDAY = registerFunc(new FuncVar("WEEKDAY", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      // ISO numbering, monday 1 through sunday 7
      int isoDay = toLocalDate(params[0]).getDayOfWeek().getValue();
      int type = getOptionalIntParam(params, 1, 1);
      switch(type) {
      case 1:
        // sunday 1 through saturday 7
        return ValueSupport.toValue((isoDay % 7) + 1);
      case 2:
        return ValueSupport.toValue(isoDay);
      case 3:
        // monday 0 through sunday 6
        return ValueSupport.toValue(isoDay - 1);
      default:
        return ValueSupport.toError(FormulaError.NUM);
      }
    }
  });

  public static final Function WEEKNUM = registerFunc(new FuncVar("WEEKNUM", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      LocalDate ld = toLocalDate(params[0]);
      int type = getOptionalIntParam(params, 1, 1);
      DayOfWeek firstDay;
      switch(type) {
      case 1:
        firstDay = DayOfWeek.SUNDAY;
        break;
      case 2:
        firstDay = DayOfWeek.MONDAY;
        break;
      default:
        return ValueSupport.toError(FormulaError.NUM);
      }
      // week 1 is the week containing january 1st
      LocalDate jan1 = ld.withDayOfYear(1);
      int jan1Offset = (jan1.getDayOfWeek().getValue() -
                        firstDay.getValue() + 7) % 7;
      return ValueSupport.toValue(
          ((ld.getDayOfYear() - 1 + jan1Offset) / 7) + 1);
    }
  });

  public static final Function WORKDAY = registerFunc(new FuncVar("WORKDAY", 2, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      LocalDate ld = toLocalDate(params[0]);
      int days = toScalar(params[1]).getAsInt();
      Set<LocalDate> holidays = getHolidays(params, 2);
      int step = ((days < 0) ? -1 : 1);
      int remaining = Math.abs(days);
      while(remaining > 0) {
        ld = ld.plusDays(step);
        if(isWorkday(ld, holidays)) {
          --remaining;
        }
      }
      return ValueSupport.toValue(toSerial(ld));
    }
  });

  public static final Function NETWORKDAYS = registerFunc(new FuncVar("NETWORKDAYS", 2, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      LocalDate start = toLocalDate(params[0]);
      LocalDate end = toLocalDate(params[1]);
      Set<LocalDate> holidays = getHolidays(params, 2);
      int sign = 1;
      if(start.isAfter(end)) {
        LocalDate tmp = start;
        start = end;
        end = tmp;
        sign = -1;
      }
      int count = 0;
      for(LocalDate ld = start; !ld.isAfter(end); ld = ld.plusDays(1)) {
        if(isWorkday(ld, holidays)) {
          ++count;
        }
      }
      return ValueSupport.toValue(sign * count);
    }
  });

  static long toSerial(LocalDate ld) {
    return ChronoUnit.DAYS.between(BASE_LD, ld);
  }

  static double toSerial(LocalDateTime ldt) {
    double days = toSerial(ldt.toLocalDate());
    return days + ((double)ldt.toLocalTime().toSecondOfDay() / SECONDS_PER_DAY);
  }

  /**
   * @return the date for the given serial number or date string
   *
   * @throws EvalException if the value is not a date
   */
  static LocalDate toLocalDate(Value param) {
    return BASE_LD.plusDays((long)Math.floor(toDateDouble(param)));
  }

  private static LocalTime toLocalTime(Value param) {
    double dd = toDateDouble(param);
    long secs = Math.round((dd - Math.floor(dd)) * SECONDS_PER_DAY);
    return LocalTime.ofSecondOfDay(secs % SECONDS_PER_DAY);
  }

  private static double toDateDouble(Value param) {
    Value val = toScalar(param);
    if(val.getType() == Value.Type.STRING) {
      Double num = ValueSupport.toNumberOrNull(val, false);
      if(num != null) {
        return num;
      }
      LocalDateTime ldt = parseDateTime(val.getAsString().trim());
      if(ldt == null) {
        throw new EvalException("Invalid date " + val);
      }
      return toSerial(ldt);
    }
    return val.getAsDouble();
  }

  private static LocalDateTime parseDateTime(String str) {
    try {
      if(str.indexOf('/') >= 0) {
        if(str.indexOf(':') >= 0) {
          return LocalDateTime.parse(str, US_DATE_TIME_FMT);
        }
        return LocalDate.parse(str, US_DATE_FMT).atStartOfDay();
      }
      if(str.indexOf('T') >= 0) {
        return LocalDateTime.parse(str);
      }
      return LocalDate.parse(str).atStartOfDay();
    } catch(DateTimeParseException e) {
      // not a date string
      return null;
    }
  }

  private static Set<LocalDate> getHolidays(Value[] params, int idx) {
    Set<LocalDate> holidays = new HashSet<LocalDate>();
    Value param = getOptionalParam(params, idx);
    if(param != null) {
      for(Value val : ValueSupport.flatten(param)) {
        if(!val.isNull()) {
          holidays.add(toLocalDate(val));
        }
      }
    }
    return holidays;
  }

  private static boolean isWorkday(LocalDate ld, Set<LocalDate> holidays) {
    DayOfWeek dow = ld.getDayOfWeek();
    return ((dow != DayOfWeek.SATURDAY) && (dow != DayOfWeek.SUNDAY) &&
            !holidays.contains(ld));
  }
}
