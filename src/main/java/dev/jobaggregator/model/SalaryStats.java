package dev.jobaggregator.model;

/**
 * Salary figures across a result set. All amounts are USD per year.
 */
public record SalaryStats(
        Integer min,
        Integer max,
        Double average,
        Integer median,
        int listingsWithSalary,
        int totalListings) {

    public static SalaryStats empty(int totalListings) {
        return new SalaryStats(null, null, null, null, 0, totalListings);
    }

    public boolean hasData() {
        return listingsWithSalary > 0;
    }

    public double coveragePercent() {
        return totalListings == 0 ? 0.0 : listingsWithSalary * 100.0 / totalListings;
    }
}
