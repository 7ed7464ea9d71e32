package tech.yump.amethyst.api.dto;

public record SecretResponse(String name, String value) {

    @Override
    public String toString() {
        return "SecretResponse[name=" + name + ", value=******]";
    }
}
