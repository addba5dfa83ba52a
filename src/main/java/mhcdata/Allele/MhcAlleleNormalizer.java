/*
 * Copyright 2016-2019 The Hong Kong University of Science and Technology
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package mhcdata.Allele;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes MHC class I allele names, e.g. "HLA-A0201", "A*02:01:01" and "HLA-A*02:01" all become
 * "HLA-A*02:01"; "H2-Kb" becomes "H-2-Kb". Only the first two allele fields are kept.
 */
public class MhcAlleleNormalizer implements AlleleNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(MhcAlleleNormalizer.class);

    public static final String HUMAN = "HLA";
    public static final String MOUSE = "H-2";

    // lower-case prefix -> canonical species. "h-2" has to be tried before "h2".
    private static final Map<String, String> speciesPrefixMap = ImmutableMap.<String, String>builder()
            .put("hla", HUMAN)
            .put("h-2", MOUSE)
            .put("h2", MOUSE)
            .put("mamu", "Mamu")
            .put("mane", "Mane")
            .put("patr", "Patr")
            .put("papa", "Papa")
            .put("gogo", "Gogo")
            .put("bola", "BoLA")
            .put("sla", "SLA")
            .put("dla", "DLA")
            .put("eqca", "Eqca")
            .put("ovar", "Ovar")
            .put("rt1", "RT1")
            .build();

    private static final Pattern separatorPattern = Pattern.compile("^[-_ ]+");
    private static final Pattern humanPattern = Pattern.compile("^(CW|[ABCEFG])[*-]?([0-9]{1,7}(?::[0-9]{1,3})*)[NLSQ]?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern mousePattern = Pattern.compile("^([KDLQ])[*-]?([A-Z]{1,3})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern otherPattern = Pattern.compile("^([A-Za-z0-9]+)(?:\\*([0-9]{1,7}(?::[0-9]{1,3})*)[A-Z]?)?$");

    public AlleleParse parse(String rawName) {
        try {
            return AlleleParse.canonical(canonicalize(rawName), rawName);
        } catch (IllegalArgumentException ex) {
            logger.debug("Cannot parse allele name {}: {}", rawName, ex.getMessage());
            return AlleleParse.unparseable(rawName);
        }
    }

    String canonicalize(String rawName) throws IllegalArgumentException {
        if (rawName == null || rawName.trim().isEmpty()) {
            throw new IllegalArgumentException("Empty allele name.");
        }
        String name = rawName.trim();
        String lowerName = name.toLowerCase(Locale.US);

        for (Map.Entry<String, String> entry : speciesPrefixMap.entrySet()) {
            if (lowerName.startsWith(entry.getKey())) {
                String rest = name.substring(entry.getKey().length());
                Matcher separatorMatcher = separatorPattern.matcher(rest);
                if (separatorMatcher.find()) {
                    rest = rest.substring(separatorMatcher.end());
                } else if (!entry.getValue().contentEquals(MOUSE)) {
                    // e.g. "SLAB" is not "SLA-B"
                    continue;
                }
                return canonicalize(entry.getValue(), rest);
            }
        }

        // no species prefix: human
        return canonicalize(HUMAN, name);
    }

    private static String canonicalize(String species, String rest) {
        if (species.contentEquals(HUMAN)) {
            Matcher matcher = humanPattern.matcher(rest);
            if (!matcher.matches()) {
                throw new IllegalArgumentException(String.format(Locale.US, "%s is not a human class I allele.", rest));
            }
            String gene = matcher.group(1).toUpperCase(Locale.US);
            if (gene.contentEquals("CW")) {
                gene = "C";
            }
            return HUMAN + "-" + gene + "*" + formatAlleleFields(matcher.group(2));
        } else if (species.contentEquals(MOUSE)) {
            Matcher matcher = mousePattern.matcher(rest);
            if (!matcher.matches()) {
                throw new IllegalArgumentException(String.format(Locale.US, "%s is not a mouse class I allele.", rest));
            }
            return MOUSE + "-" + matcher.group(1).toUpperCase(Locale.US) + matcher.group(2).toLowerCase(Locale.US);
        } else {
            Matcher matcher = otherPattern.matcher(rest);
            if (!matcher.matches()) {
                throw new IllegalArgumentException(String.format(Locale.US, "%s is not a %s allele.", rest, species));
            }
            if (matcher.group(2) == null) {
                return species + "-" + matcher.group(1);
            }
            return species + "-" + matcher.group(1) + "*" + formatAlleleFields(matcher.group(2));
        }
    }

    // "02:01:01" -> "02:01", "0201" -> "02:01", "02101" -> "02:101", "2" -> "02", "001" -> "001"
    static String formatAlleleFields(String digits) {
        String first;
        String second;
        if (digits.contains(":")) {
            String[] fields = digits.split(":");
            first = fields[0];
            second = fields[1];
        } else if (digits.length() <= 3) {
            first = digits;
            second = null;
        } else if (digits.length() == 5) {
            first = digits.substring(0, 2);
            second = digits.substring(2);
        } else {
            first = digits.substring(0, 2);
            second = digits.substring(2, 4);
        }

        if (first.length() < 2) {
            first = "0" + first;
        }
        if (second == null) {
            return first;
        }
        if (second.length() < 2) {
            second = "0" + second;
        }
        return first + ":" + second;
    }
}
