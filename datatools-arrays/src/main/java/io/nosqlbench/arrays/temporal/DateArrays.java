/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.arrays.temporal;

import io.nosqlbench.arrays.ArrayChecks;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/// # DateArrays
///
/// Range queries, calendar grouping and business-day arithmetic over
/// `LocalDateTime[]`.
///
/// ## Grouping
/// Every `groupBy*` method returns a [LinkedHashMap] whose keys appear in the
/// order their first date appears in the input. Dates under each key keep
/// input order.
///
/// ## Clock
/// [#allInFuture(LocalDateTime[], Clock)] and [#allInPast(LocalDateTime[], Clock)]
/// read "now" from the supplied [Clock]; the single-argument forms use the
/// system default zone.
///
/// ## Weekends
/// Saturday and Sunday are weekend days. [#businessDaysCount(LocalDateTime[], LocalDate[])]
/// matches holidays by calendar date, while
/// [#filterHolidays(LocalDateTime[], LocalDateTime[])] compares exact date-times.
public final class DateArrays {

    private DateArrays() {} // Utility class

    public static LocalDateTime earliest(LocalDateTime[] dates) {
        ArrayChecks.requireNonEmpty(dates, "dates");
        LocalDateTime earliest = dates[0];
        for (LocalDateTime date : dates) {
            if (date.isBefore(earliest)) earliest = date;
        }
        return earliest;
    }

    public static LocalDateTime latest(LocalDateTime[] dates) {
        ArrayChecks.requireNonEmpty(dates, "dates");
        LocalDateTime latest = dates[0];
        for (LocalDateTime date : dates) {
            if (date.isAfter(latest)) latest = date;
        }
        return latest;
    }

    /// @return the duration from the earliest to the latest date
    public static Duration range(LocalDateTime[] dates) {
        return Duration.between(earliest(dates), latest(dates));
    }

    /// Dates within `[start, end]`, both ends inclusive.
    public static LocalDateTime[] filterByRange(LocalDateTime[] dates, LocalDateTime start, LocalDateTime end) {
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(end, "end cannot be null");
        return filter(dates, date -> !date.isBefore(start) && !date.isAfter(end));
    }

    public static boolean allInFuture(LocalDateTime[] dates) {
        return allInFuture(dates, Clock.systemDefaultZone());
    }

    /// True when every date is strictly after now. An empty array is vacuously true.
    public static boolean allInFuture(LocalDateTime[] dates, Clock clock) {
        Objects.requireNonNull(dates, "dates cannot be null");
        LocalDateTime now = LocalDateTime.now(clock);
        return Arrays.stream(dates).allMatch(date -> date.isAfter(now));
    }

    public static boolean allInPast(LocalDateTime[] dates) {
        return allInPast(dates, Clock.systemDefaultZone());
    }

    /// True when every date is strictly before now. An empty array is vacuously true.
    public static boolean allInPast(LocalDateTime[] dates, Clock clock) {
        Objects.requireNonNull(dates, "dates cannot be null");
        LocalDateTime now = LocalDateTime.now(clock);
        return Arrays.stream(dates).allMatch(date -> date.isBefore(now));
    }

    /// @return the date nearest to `reference`; the first such date on ties
    public static LocalDateTime closestTo(LocalDateTime[] dates, LocalDateTime reference) {
        ArrayChecks.requireNonEmpty(dates, "dates");
        Objects.requireNonNull(reference, "reference cannot be null");
        LocalDateTime closest = dates[0];
        Duration best = distance(closest, reference);
        for (LocalDateTime date : dates) {
            Duration d = distance(date, reference);
            if (d.compareTo(best) < 0) {
                closest = date;
                best = d;
            }
        }
        return closest;
    }

    /// Every date at the minimal distance from `reference`, in input order.
    public static LocalDateTime[] equidistantDates(LocalDateTime[] dates, LocalDateTime reference) {
        Duration minimum = distance(closestTo(dates, reference), reference);
        return filter(dates, date -> distance(date, reference).equals(minimum));
    }

    public static Map<Integer, List<LocalDateTime>> groupByYear(LocalDateTime[] dates) {
        return groupBy(dates, LocalDateTime::getYear);
    }

    public static Map<Month, List<LocalDateTime>> groupByMonth(LocalDateTime[] dates) {
        return groupBy(dates, LocalDateTime::getMonth);
    }

    public static Map<Integer, List<LocalDateTime>> groupByDayOfMonth(LocalDateTime[] dates) {
        return groupBy(dates, LocalDateTime::getDayOfMonth);
    }

    public static Map<DayOfWeek, List<LocalDateTime>> groupByDayOfWeek(LocalDateTime[] dates) {
        return groupBy(dates, LocalDateTime::getDayOfWeek);
    }

    /// Keys are quarters 1 to 4.
    public static Map<Integer, List<LocalDateTime>> groupByQuarter(LocalDateTime[] dates) {
        return groupBy(dates, date -> (date.getMonthValue() - 1) / 3 + 1);
    }

    public static Map<Season, List<LocalDateTime>> groupBySeason(LocalDateTime[] dates) {
        return groupBy(dates, date -> Season.of(date.getMonth()));
    }

    /// Keys are the first year of each decade, such as 1990 or 2020.
    public static Map<Integer, List<LocalDateTime>> groupByDecade(LocalDateTime[] dates) {
        return groupBy(dates, date -> date.getYear() - Math.floorMod(date.getYear(), 10));
    }

    public static LocalDateTime[] filterWeekdays(LocalDateTime[] dates) {
        return filter(dates, date -> !isWeekend(date.getDayOfWeek()));
    }

    public static LocalDateTime[] filterWeekends(LocalDateTime[] dates) {
        return filter(dates, date -> isWeekend(date.getDayOfWeek()));
    }

    /// Distinct dates that also appear in `holidays`, compared exactly, in
    /// first-seen order.
    public static LocalDateTime[] filterHolidays(LocalDateTime[] dates, LocalDateTime[] holidays) {
        Objects.requireNonNull(dates, "dates cannot be null");
        Objects.requireNonNull(holidays, "holidays cannot be null");
        Set<LocalDateTime> holidaySet = new HashSet<>(Arrays.asList(holidays));
        Set<LocalDateTime> result = new LinkedHashSet<>();
        for (LocalDateTime date : dates) {
            if (holidaySet.contains(date)) {
                result.add(date);
            }
        }
        return result.toArray(new LocalDateTime[0]);
    }

    /// Counts Monday to Friday calendar days from the earliest to the latest
    /// date, both inclusive. Times of day are dropped first, so this counts
    /// calendar dates rather than elapsed whole days: Monday 23:59 to Tuesday
    /// 00:01 is two business days.
    public static int businessDaysCount(LocalDateTime[] dates) {
        return businessDaysCount(dates, new LocalDate[0]);
    }

    /// Counts Monday to Friday calendar days from the earliest to the latest
    /// date, both inclusive, skipping any day listed in `holidays`.
    public static int businessDaysCount(LocalDateTime[] dates, LocalDate[] holidays) {
        Objects.requireNonNull(holidays, "holidays cannot be null");
        LocalDate start = earliest(dates).toLocalDate();
        LocalDate end = latest(dates).toLocalDate();
        Set<LocalDate> excluded = new HashSet<>(Arrays.asList(holidays));
        int count = 0;
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            if (!isWeekend(day.getDayOfWeek()) && !excluded.contains(day)) {
                count++;
            }
        }
        return count;
    }

    /// Dates that are the `n`th occurrence of `dayOfWeek` in their month.
    /// @param n occurrence, 1 to 5
    /// @throws io.nosqlbench.arrays.ValueOutOfRangeException if n is outside 1..5
    public static LocalDateTime[] filterNthDayOfWeek(LocalDateTime[] dates, DayOfWeek dayOfWeek, int n) {
        Objects.requireNonNull(dayOfWeek, "dayOfWeek cannot be null");
        ArrayChecks.requireInRange(n, 1, 5, "n");
        return filter(dates, date -> date.getDayOfWeek() == dayOfWeek
            && (date.getDayOfMonth() - 1) / 7 == n - 1);
    }

    /// Dates that are the last occurrence of `dayOfWeek` in their month.
    public static LocalDateTime[] filterLastDayOfWeek(LocalDateTime[] dates, DayOfWeek dayOfWeek) {
        Objects.requireNonNull(dayOfWeek, "dayOfWeek cannot be null");
        return filter(dates, date -> date.getDayOfWeek() == dayOfWeek
            && date.plusDays(7).getMonth() != date.getMonth());
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private static Duration distance(LocalDateTime date, LocalDateTime reference) {
        return Duration.between(reference, date).abs();
    }

    private static LocalDateTime[] filter(LocalDateTime[] dates, Predicate<LocalDateTime> predicate) {
        Objects.requireNonNull(dates, "dates cannot be null");
        return Arrays.stream(dates).filter(predicate).toArray(LocalDateTime[]::new);
    }

    private static <K> Map<K, List<LocalDateTime>> groupBy(LocalDateTime[] dates,
                                                            Function<LocalDateTime, K> key) {
        Objects.requireNonNull(dates, "dates cannot be null");
        Map<K, List<LocalDateTime>> groups = new LinkedHashMap<>();
        for (LocalDateTime date : dates) {
            groups.computeIfAbsent(key.apply(date), k -> new ArrayList<>()).add(date);
        }
        return groups;
    }
}
