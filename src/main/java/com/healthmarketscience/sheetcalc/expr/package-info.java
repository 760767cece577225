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

/**
 * The formula engine evaluates spreadsheet formulas (e.g.
 * {@code =SUM(A1:A3)*2}) against cell values supplied by the caller through a
 * {@link com.healthmarketscience.sheetcalc.CellValueAccessor}.  Results are
 * scalar values, errors (see {@link com.healthmarketscience.sheetcalc.expr.FormulaError}) or
 * arrays, which the engine spills into the neighboring cells.
 * <p/>
 * <h2>Supporting Classes</h2>
 * <p/>
 * <ul>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.EvalConfig} allows for customization of the evaluation
 *     (functions, clock and random source) for a given
 *     {@link com.healthmarketscience.sheetcalc.FormulaEngine} instance.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.FunctionLookup} provides a source for {@link com.healthmarketscience.sheetcalc.expr.Function} instances
 *     used during evaluation.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.Expression} is a parsed formula, which can report the
 *     cells it references.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.Value} represents a typed value.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.ParseException} is thrown by
 *     {@link com.healthmarketscience.sheetcalc.FormulaEngine#parseFormula} for invalid formulas.  The
 *     evaluation methods never throw for formula problems, they return
 *     error values instead.</li>
 * </ul>
 * <p/>
 * <h2>Function Support</h2>
 * <p/>
 * The following tables list the functions built into the default
 * {@link com.healthmarketscience.sheetcalc.expr.FunctionLookup}.  Special forms are handled by the parser
 * since they control the evaluation of their own arguments.  Marker
 * functions return an opaque string (a prefix followed by a JSON object)
 * meant for the rendering layer.
 *
 * <h3>Logical</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>IF</td><td>Special form</td></tr>
 * <tr class="TableRowColor"><td>IFS</td><td></td></tr>
 * <tr class="TableRowColor"><td>IFERROR</td><td>Special form</td></tr>
 * <tr class="TableRowColor"><td>IFNA</td><td>Special form</td></tr>
 * <tr class="TableRowColor"><td>SWITCH</td><td></td></tr>
 * <tr class="TableRowColor"><td>AND</td><td></td></tr>
 * <tr class="TableRowColor"><td>OR</td><td></td></tr>
 * <tr class="TableRowColor"><td>XOR</td><td></td></tr>
 * <tr class="TableRowColor"><td>NOT</td><td></td></tr>
 * </table>
 *
 * <h3>Information</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>ISBLANK</td><td></td></tr>
 * <tr class="TableRowColor"><td>ISERROR</td><td></td></tr>
 * <tr class="TableRowColor"><td>ISNUMBER</td><td></td></tr>
 * <tr class="TableRowColor"><td>ISTEXT</td><td></td></tr>
 * <tr class="TableRowColor"><td>ISLOGICAL</td><td></td></tr>
 * <tr class="TableRowColor"><td>TYPE</td><td></td></tr>
 * </table>
 *
 * <h3>Math</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>ABS</td><td></td></tr>
 * <tr class="TableRowColor"><td>CEILING</td><td></td></tr>
 * <tr class="TableRowColor"><td>EXP</td><td></td></tr>
 * <tr class="TableRowColor"><td>FLOOR</td><td></td></tr>
 * <tr class="TableRowColor"><td>LOG</td><td></td></tr>
 * <tr class="TableRowColor"><td>LOG10</td><td></td></tr>
 * <tr class="TableRowColor"><td>MOD</td><td></td></tr>
 * <tr class="TableRowColor"><td>PI</td><td></td></tr>
 * <tr class="TableRowColor"><td>POWER</td><td></td></tr>
 * <tr class="TableRowColor"><td>RAND</td><td></td></tr>
 * <tr class="TableRowColor"><td>RANDBETWEEN</td><td></td></tr>
 * <tr class="TableRowColor"><td>ROUND</td><td></td></tr>
 * <tr class="TableRowColor"><td>ROUNDDOWN</td><td></td></tr>
 * <tr class="TableRowColor"><td>ROUNDUP</td><td></td></tr>
 * <tr class="TableRowColor"><td>SQRT</td><td></td></tr>
 * </table>
 *
 * <h3>Aggregate</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>AVERAGE</td><td></td></tr>
 * <tr class="TableRowColor"><td>AVERAGEIF</td><td></td></tr>
 * <tr class="TableRowColor"><td>AVERAGEIFS</td><td></td></tr>
 * <tr class="TableRowColor"><td>COUNT</td><td></td></tr>
 * <tr class="TableRowColor"><td>COUNTA</td><td></td></tr>
 * <tr class="TableRowColor"><td>COUNTBLANK</td><td></td></tr>
 * <tr class="TableRowColor"><td>COUNTIF</td><td></td></tr>
 * <tr class="TableRowColor"><td>COUNTIFS</td><td></td></tr>
 * <tr class="TableRowColor"><td>MAX</td><td></td></tr>
 * <tr class="TableRowColor"><td>MIN</td><td></td></tr>
 * <tr class="TableRowColor"><td>SUM</td><td></td></tr>
 * <tr class="TableRowColor"><td>SUMIF</td><td></td></tr>
 * <tr class="TableRowColor"><td>SUMIFS</td><td></td></tr>
 * </table>
 *
 * <h3>Statistical</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>CORREL</td><td></td></tr>
 * <tr class="TableRowColor"><td>FORECAST</td><td></td></tr>
 * <tr class="TableRowColor"><td>LARGE</td><td></td></tr>
 * <tr class="TableRowColor"><td>MEDIAN</td><td></td></tr>
 * <tr class="TableRowColor"><td>MODE</td><td></td></tr>
 * <tr class="TableRowColor"><td>PERCENTILE</td><td></td></tr>
 * <tr class="TableRowColor"><td>QUARTILE</td><td></td></tr>
 * <tr class="TableRowColor"><td>RANK</td><td></td></tr>
 * <tr class="TableRowColor"><td>SMALL</td><td></td></tr>
 * <tr class="TableRowColor"><td>STDEV</td><td></td></tr>
 * <tr class="TableRowColor"><td>VAR</td><td></td></tr>
 * </table>
 *
 * <h3>Text</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>CHAR</td><td></td></tr>
 * <tr class="TableRowColor"><td>CLEAN</td><td></td></tr>
 * <tr class="TableRowColor"><td>CODE</td><td></td></tr>
 * <tr class="TableRowColor"><td>CONCATENATE</td><td></td></tr>
 * <tr class="TableRowColor"><td>EXACT</td><td></td></tr>
 * <tr class="TableRowColor"><td>FIND</td><td></td></tr>
 * <tr class="TableRowColor"><td>LEFT</td><td></td></tr>
 * <tr class="TableRowColor"><td>LEN</td><td></td></tr>
 * <tr class="TableRowColor"><td>LOWER</td><td></td></tr>
 * <tr class="TableRowColor"><td>MID</td><td></td></tr>
 * <tr class="TableRowColor"><td>PROPER</td><td></td></tr>
 * <tr class="TableRowColor"><td>REGEXEXTRACT</td><td></td></tr>
 * <tr class="TableRowColor"><td>REGEXMATCH</td><td></td></tr>
 * <tr class="TableRowColor"><td>REGEXREPLACE</td><td></td></tr>
 * <tr class="TableRowColor"><td>REPT</td><td></td></tr>
 * <tr class="TableRowColor"><td>RIGHT</td><td></td></tr>
 * <tr class="TableRowColor"><td>SEARCH</td><td></td></tr>
 * <tr class="TableRowColor"><td>SUBSTITUTE</td><td></td></tr>
 * <tr class="TableRowColor"><td>TEXT</td><td></td></tr>
 * <tr class="TableRowColor"><td>TRIM</td><td></td></tr>
 * <tr class="TableRowColor"><td>UPPER</td><td></td></tr>
 * <tr class="TableRowColor"><td>VALUE</td><td></td></tr>
 * </table>
 *
 * <h3>Date/Time</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>DATE</td><td></td></tr>
 * <tr class="TableRowColor"><td>DATEDIF</td><td></td></tr>
 * <tr class="TableRowColor"><td>DAY</td><td></td></tr>
 * <tr class="TableRowColor"><td>EDATE</td><td></td></tr>
 * <tr class="TableRowColor"><td>EOMONTH</td><td></td></tr>
 * <tr class="TableRowColor"><td>HOUR</td><td></td></tr>
 * <tr class="TableRowColor"><td>MINUTE</td><td></td></tr>
 * <tr class="TableRowColor"><td>MONTH</td><td></td></tr>
 * <tr class="TableRowColor"><td>NETWORKDAYS</td><td></td></tr>
 * <tr class="TableRowColor"><td>NOW</td><td></td></tr>
 * <tr class="TableRowColor"><td>SECOND</td><td></td></tr>
 * <tr class="TableRowColor"><td>TODAY</td><td></td></tr>
 * <tr class="TableRowColor"><td>WEEKDAY</td><td></td></tr>
 * <tr class="TableRowColor"><td>WEEKNUM</td><td></td></tr>
 * <tr class="TableRowColor"><td>WORKDAY</td><td></td></tr>
 * <tr class="TableRowColor"><td>YEAR</td><td></td></tr>
 * </table>
 *
 * <h3>Financial</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>FV</td><td></td></tr>
 * <tr class="TableRowColor"><td>IRR</td><td></td></tr>
 * <tr class="TableRowColor"><td>NPER</td><td></td></tr>
 * <tr class="TableRowColor"><td>NPV</td><td></td></tr>
 * <tr class="TableRowColor"><td>PMT</td><td></td></tr>
 * <tr class="TableRowColor"><td>PV</td><td></td></tr>
 * <tr class="TableRowColor"><td>RATE</td><td></td></tr>
 * </table>
 *
 * <h3>Lookup/Reference</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>CHOOSE</td><td></td></tr>
 * <tr class="TableRowColor"><td>COLUMN</td><td>Special form</td></tr>
 * <tr class="TableRowColor"><td>COLUMNS</td><td></td></tr>
 * <tr class="TableRowColor"><td>HLOOKUP</td><td></td></tr>
 * <tr class="TableRowColor"><td>INDEX</td><td></td></tr>
 * <tr class="TableRowColor"><td>MATCH</td><td></td></tr>
 * <tr class="TableRowColor"><td>ROW</td><td>Special form</td></tr>
 * <tr class="TableRowColor"><td>ROWS</td><td></td></tr>
 * <tr class="TableRowColor"><td>VLOOKUP</td><td></td></tr>
 * <tr class="TableRowColor"><td>XLOOKUP</td><td></td></tr>
 * </table>
 *
 * <h3>Array</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>ARRAYFORMULA</td><td>Special form</td></tr>
 * <tr class="TableRowColor"><td>FILTER</td><td></td></tr>
 * <tr class="TableRowColor"><td>IMAGE</td><td>Marker</td></tr>
 * <tr class="TableRowColor"><td>LAMBDA</td><td>Special form</td></tr>
 * <tr class="TableRowColor"><td>LET</td><td>Special form</td></tr>
 * <tr class="TableRowColor"><td>SORT</td><td></td></tr>
 * <tr class="TableRowColor"><td>SPARKLINE</td><td>Marker</td></tr>
 * <tr class="TableRowColor"><td>TRANSPOSE</td><td></td></tr>
 * <tr class="TableRowColor"><td>UNIQUE</td><td></td></tr>
 * </table>
 */
package com.healthmarketscience.sheetcalc.expr;
