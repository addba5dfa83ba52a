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

package mhcdata.Types;

import java.util.Objects;
import java.util.regex.Pattern;

public class MeasurementRecord {

    public static final String UNKNOWN_ALLELE = "UNKNOWN";
    public static final Pattern peptidePattern = Pattern.compile("^[ACDEFGHIKLMNPQRSTVWY]+$");

    public final String allele;
    public final String peptide;
    public final Double measurementValue; // nM
    public final MeasurementInequality measurementInequality;
    public final MeasurementType measurementType;
    public final String measurementSource;
    public final String originalAllele;

    private final int hashCode;

    public MeasurementRecord(String allele, String peptide, Double measurementValue, MeasurementInequality measurementInequality, MeasurementType measurementType, String measurementSource, String originalAllele) {
        this.allele = allele;
        this.peptide = peptide;
        this.measurementValue = measurementValue;
        this.measurementInequality = measurementInequality;
        this.measurementType = measurementType;
        this.measurementSource = measurementSource;
        this.originalAllele = originalAllele;

        hashCode = Objects.hash(allele, peptide, measurementValue, measurementInequality, measurementType, measurementSource, originalAllele);
    }

    public boolean hasMissingField() {
        return allele == null || peptide == null || measurementValue == null || measurementInequality == null || measurementType == null || measurementSource == null || originalAllele == null;
    }

    public boolean hasValidPeptide() {
        return peptide != null && peptidePattern.matcher(peptide).matches();
    }

    public boolean hasKnownAllele() {
        return allele != null && !allele.contentEquals(UNKNOWN_ALLELE);
    }

    public int hashCode() {
        return hashCode;
    }

    public boolean equals(Object other) {
        if (other instanceof MeasurementRecord) {
            MeasurementRecord temp = (MeasurementRecord) other;
            return Objects.equals(allele, temp.allele)
                    && Objects.equals(peptide, temp.peptide)
                    && Objects.equals(measurementValue, temp.measurementValue)
                    && measurementInequality == temp.measurementInequality
                    && measurementType == temp.measurementType
                    && Objects.equals(measurementSource, temp.measurementSource)
                    && Objects.equals(originalAllele, temp.originalAllele);
        } else {
            return false;
        }
    }

    public String toString() {
        return allele + "," + peptide + "," + measurementValue + "," + (measurementInequality == null ? null : measurementInequality.getSymbol()) + "," + (measurementType == null ? null : measurementType.getLabel()) + "," + measurementSource + "," + originalAllele;
    }
}
