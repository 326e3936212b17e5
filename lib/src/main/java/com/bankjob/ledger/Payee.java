package com.bankjob.ledger;

import java.util.Objects;

/**
 * Optional enrichment of a {@link Transaction} naming who was paid or who paid. Only the name
 * reaches the CSV output (as a prefix of the description); the OFX output carries every field.
 */
public final class Payee {
    private String name;
    private String address;
    private String city;
    private String state;
    private String postalCode;
    private String country;
    private String phone;

    public Payee() {}

    public Payee(String name) {
        this.name = name;
    }

    public Payee copy() {
        Payee copy = new Payee(name);
        copy.address = address;
        copy.city = city;
        copy.state = state;
        copy.postalCode = postalCode;
        copy.country = country;
        copy.phone = phone;
        return copy;
    }

    /** {@code PAYEE} aggregate; {@code COUNTRY} is optional in the schema and omitted when unset. */
    public OfxElement toOfxElement() {
        return OfxElement.aggregate("PAYEE")
                .leaf("NAME", name)
                .leaf("ADDR1", address)
                .leaf("CITY", city)
                .leaf("STATE", state)
                .leaf("POSTALCODE", postalCode)
                .optionalLeaf("COUNTRY", country)
                .leaf("PHONE", phone)
                .build();
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getPostalCode() {
        return postalCode;
    }

    public void setPostalCode(String postalCode) {
        this.postalCode = postalCode;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Payee)) {
            return false;
        }
        Payee that = (Payee) other;
        return Objects.equals(name, that.name)
                && Objects.equals(address, that.address)
                && Objects.equals(city, that.city)
                && Objects.equals(state, that.state)
                && Objects.equals(postalCode, that.postalCode)
                && Objects.equals(country, that.country)
                && Objects.equals(phone, that.phone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, address, city, state, postalCode, country, phone);
    }

    @Override
    public String toString() {
        return name == null ? "" : name;
    }
}
