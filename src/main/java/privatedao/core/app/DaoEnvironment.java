/*
 * This file is part of PrivateDAO.
 *
 * PrivateDAO is free software: you can redistribute it and/or modify it
 * under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or (at
 * your option) any later version.
 *
 * PrivateDAO is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public
 * License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with PrivateDAO. If not, see <http://www.gnu.org/licenses/>.
 */

package privatedao.core.app;

import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertiesPropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.support.ResourcePropertySource;

import java.io.IOException;

import java.util.Properties;

/**
 * Property lookup order: explicit overrides, JVM system properties, OS environment, then the defaults shipped in
 * {@value #DEFAULT_PROPERTIES_LOCATION}.
 */
public class DaoEnvironment extends StandardEnvironment {
    public static final String DEFAULT_PROPERTIES_LOCATION = "classpath:privatedao.properties";

    static final String OVERRIDES_PROPERTY_SOURCE_NAME = "privateDaoOverrides";
    static final String DEFAULTS_PROPERTY_SOURCE_NAME = "privateDaoDefaults";

    public DaoEnvironment() throws IOException {
        this(new Properties());
    }

    public DaoEnvironment(Properties overrides) throws IOException {
        MutablePropertySources propertySources = getPropertySources();
        propertySources.addFirst(new PropertiesPropertySource(OVERRIDES_PROPERTY_SOURCE_NAME, overrides));
        propertySources.addLast(new ResourcePropertySource(DEFAULTS_PROPERTY_SOURCE_NAME,
                DEFAULT_PROPERTIES_LOCATION));
    }
}
