package io.cronlattice.core.database.migrate;

import java.util.ArrayList;
import java.util.List;

public class CreateTableBuilder
{
    private final boolean postgres;
    private final String name;
    private final List<String> columns = new ArrayList<>();

    CreateTableBuilder(boolean postgres, String name)
    {
        this.postgres = postgres;
        this.name = name;
    }

    public CreateTableBuilder add(String column, String typeAndOptions)
    {
        columns.add(column + " " + typeAndOptions);
        return this;
    }

    public CreateTableBuilder addLong(String column, String options)
    {
        return add(column, "bigint " + options);
    }

    public CreateTableBuilder addString(String column, String options)
    {
        if (postgres) {
            return add(column, "text " + options);
        }
        else {
            return add(column, "varchar(255) " + options);
        }
    }

    public CreateTableBuilder addText(String column, String options)
    {
        if (postgres) {
            return add(column, "text " + options);
        }
        else {
            // h2 can't compare clob values in where clauses
            return add(column, "varchar(4096) " + options);
        }
    }

    public CreateTableBuilder addTimestamp(String column, String options)
    {
        if (postgres) {
            return add(column, "timestamp with time zone " + options);
        }
        else {
            return add(column, "timestamp " + options);
        }
    }

    public CreateTableBuilder addPrimaryKey(String... columnNames)
    {
        columns.add("primary key (" + String.join(", ", columnNames) + ")");
        return this;
    }

    public String build()
    {
        StringBuilder sb = new StringBuilder();
        sb.append("CREATE TABLE " + name + " (\n");
        for (int i = 0; i < columns.size(); i++) {
            sb.append("  ");
            sb.append(columns.get(i));
            if (i + 1 < columns.size()) {
                sb.append(",\n");
            }
            else {
                sb.append("\n");
            }
        }
        sb.append(")");
        return sb.toString();
    }
}
